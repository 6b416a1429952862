package io.clientmock.core.engine;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.template.TemplateNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only store of the expectations registered for one mocked client.
 *
 * <p>Expectations are indexed by {@code (method, path part of the normalized template)}, folded
 * to lower case when templates compare case-insensitively. The key is deliberately loose: it
 * only narrows the candidates, and {@link RequestMatcher} makes the final decision. Expectations
 * without a method are indexed separately and returned for every method.
 *
 * <p>Registration order is preserved in every result, so the earliest registered matching
 * expectation can win. Nothing is ever evicted; create one registry per mocked client per test.
 *
 * <p>Not thread-safe.
 */
public final class ExpectationRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ExpectationRegistry.class);

    private final MockSettings settings;
    private final List<Entry> entries = new ArrayList<>();
    private final Map<Key, List<Entry>> byMethod = new HashMap<>();
    private final Map<String, List<Entry>> anyMethod = new HashMap<>();

    public ExpectationRegistry() {
        this(MockSettings.defaults());
    }

    public ExpectationRegistry(MockSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Adds an expectation. Registering an equal expectation twice keeps both.
     *
     * @param expectation the expectation to add
     */
    public void register(Expectation expectation) {
        Objects.requireNonNull(expectation, "expectation must not be null");
        Entry entry = new Entry(entries.size(), expectation);
        entries.add(entry);
        String path = pathKey(expectation.normalizedTemplate());
        if (expectation.method() == null) {
            anyMethod.computeIfAbsent(path, k -> new ArrayList<>()).add(entry);
        } else {
            byMethod.computeIfAbsent(new Key(expectation.method(), path), k -> new ArrayList<>()).add(entry);
        }
        LOG.debug("Registered expectation #{}: {}", entry.sequence(), expectation.describe());
    }

    /**
     * Expectations that may match a request with the given method and normalized template, in
     * registration order.
     *
     * @param method             the request method
     * @param normalizedTemplate the request's normalized template
     * @return the candidates, possibly empty
     */
    public List<Expectation> candidatesFor(HttpMethod method, String normalizedTemplate) {
        String path = pathKey(normalizedTemplate);
        List<Entry> exact = byMethod.getOrDefault(new Key(method, path), List.of());
        List<Entry> any = anyMethod.getOrDefault(path, List.of());
        if (any.isEmpty()) {
            return exact.stream().map(Entry::expectation).toList();
        }
        if (exact.isEmpty()) {
            return any.stream().map(Entry::expectation).toList();
        }
        List<Entry> merged = new ArrayList<>(exact.size() + any.size());
        merged.addAll(exact);
        merged.addAll(any);
        merged.sort((a, b) -> Integer.compare(a.sequence(), b.sequence()));
        return merged.stream().map(Entry::expectation).toList();
    }

    /** Every registered expectation, in registration order. */
    public List<Expectation> all() {
        List<Expectation> result = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            result.add(entry.expectation());
        }
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private String pathKey(String normalizedTemplate) {
        String path = TemplateNormalizer.stripQueryFragments(normalizedTemplate);
        return settings.ignoreCase() ? path.toLowerCase(Locale.ROOT) : path;
    }

    private record Key(HttpMethod method, String path) {}

    private record Entry(int sequence, Expectation expectation) {}
}
