package io.clientmock.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable, case-insensitive request header collection.
 *
 * <p>Header names are stored lowercase; lookups ignore case. Each name maps to a non-empty list
 * of values.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final TreeMap<String, List<String>> values;

    private HttpHeaders(TreeMap<String, List<String>> values) {
        this.values = values;
    }

    /**
     * First value of a header, or {@code null} when absent.
     *
     * @param name header name, any case
     */
    public String first(String name) {
        List<String> list = values.get(name);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    /** All values of a header, or an empty list when absent. */
    public List<String> all(String name) {
        List<String> list = values.get(name);
        return list == null ? List.of() : list;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** Lowercase header names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Creates headers from a single-value map.
     *
     * @param singleValue header name → value; may be null
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((name, value) -> map.put(name.toLowerCase(Locale.ROOT), List.of(value)));
        return new HttpHeaders(map);
    }

    /**
     * Creates headers from a multi-value map. Names with no values are dropped.
     *
     * @param multiValue header name → values; may be null
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((name, list) -> {
            if (list != null && !list.isEmpty()) {
                map.put(name.toLowerCase(Locale.ROOT), List.copyOf(list));
            }
        });
        return map.isEmpty() ? EMPTY : new HttpHeaders(map);
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + values;
    }
}
