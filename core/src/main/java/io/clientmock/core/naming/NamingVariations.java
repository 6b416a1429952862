package io.clientmock.core.naming;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the spellings a code generator may have used for a logical parameter name.
 *
 * <p>Generators rename parameters: {@code fundId} can reach the request as {@code fund-id}, as
 * {@code fund%2Did} when the hyphen is percent-encoded inside the raw template, or as
 * {@code FundId}. Query parameters additionally appear with an OData {@code $} prefix
 * ({@code $select}), itself sometimes encoded ({@code %24select}).
 *
 * <p>Variation lists are ordered (first match wins), free of duplicates and always start with
 * the original spelling.
 */
public final class NamingVariations {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private NamingVariations() {}

    /**
     * Candidate spellings for a path parameter: original, kebab-case, percent-encoded kebab-case,
     * PascalCase.
     *
     * @param name the logical name, e.g. {@code fundId}
     * @return e.g. {@code [fundId, fund-id, fund%2Did, FundId]}
     */
    public static List<String> forPathParameter(String name) {
        Objects.requireNonNull(name, "parameter name must not be null");
        Set<String> variations = new LinkedHashSet<>();
        addPathVariations(variations, name);
        return List.copyOf(variations);
    }

    /**
     * Candidate spellings for a query parameter: the path variations followed by {@code $name},
     * {@code %24name} and {@code $kebab-name}.
     *
     * @param name the logical name, e.g. {@code select}
     */
    public static List<String> forQueryParameter(String name) {
        Objects.requireNonNull(name, "parameter name must not be null");
        Set<String> variations = new LinkedHashSet<>();
        addPathVariations(variations, name);
        String bare = name.startsWith("$") ? name.substring(1) : name;
        variations.add("$" + bare);
        variations.add("%24" + bare);
        variations.add("$" + toKebabCase(bare));
        return List.copyOf(variations);
    }

    /**
     * Inserts {@code -} before every uppercase letter except at index 0, then lowercases.
     *
     * @param name e.g. {@code fundId}
     * @return e.g. {@code fund-id}
     */
    public static String toKebabCase(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                sb.append('-');
            }
            sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /** Uppercases the first character only. */
    public static String toPascalCase(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Percent-encodes every character that is not an ASCII letter or digit, as UTF-8 bytes in
     * uppercase hex.
     *
     * @param value e.g. {@code fund-id}
     * @return e.g. {@code fund%2Did}
     */
    public static String percentEncode(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int ch = b & 0xFF;
            if ((ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9')) {
                sb.append((char) ch);
            } else {
                sb.append('%').append(HEX[ch >> 4]).append(HEX[ch & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * Decodes percent-escapes. {@code +} is kept literally. Returns the input unchanged if it
     * contains a malformed escape.
     */
    public static String decode(String value) {
        if (value == null || value.indexOf('%') < 0) {
            return value;
        }
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    /**
     * Formats map keys for diagnostics: each key followed by its decoded form when that differs.
     *
     * @param keys raw keys
     * @return e.g. {@code [fund%2Did (decoded: fund-id), select]}
     */
    public static List<String> describeKeys(Iterable<String> keys) {
        List<String> described = new ArrayList<>();
        for (String key : keys) {
            String decoded = decode(key);
            described.add(decoded != null && !decoded.equals(key) ? key + " (decoded: " + decoded + ")" : key);
        }
        return described;
    }

    private static void addPathVariations(Set<String> variations, String name) {
        variations.add(name);
        String kebab = toKebabCase(name);
        variations.add(kebab);
        variations.add(percentEncode(kebab));
        variations.add(toPascalCase(name));
    }
}
