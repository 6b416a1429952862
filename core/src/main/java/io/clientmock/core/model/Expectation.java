package io.clientmock.core.model;

import io.clientmock.core.predicate.RequestPredicate;
import io.clientmock.core.template.TemplateNormalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A registered rule: which simulated request gets which canned outcome.
 *
 * <p>Created when a test mocks an endpoint and never updated in place; mocking the same endpoint
 * again registers another expectation.
 *
 * @param method             the HTTP method to match, or {@code null} to match any method
 * @param urlTemplate        the template as the test supplied it (or as the builder reported it)
 * @param normalizedTemplate {@code urlTemplate} in canonical form
 * @param strategy           how the template is compared
 * @param builderParameters  the builder's path parameters; only used by
 *                           {@link MatchStrategy#BUILDER}
 * @param kind               the dispatcher operation this expectation answers
 * @param responseType       the requested response type to match, or {@code null} for any
 * @param outcome            what a match produces
 * @param predicate          an extra filter over the request, or {@code null}
 */
public record Expectation(
        HttpMethod method,
        String urlTemplate,
        String normalizedTemplate,
        MatchStrategy strategy,
        Map<String, Object> builderParameters,
        ResponseKind kind,
        Class<?> responseType,
        Outcome outcome,
        RequestPredicate predicate) {

    public Expectation {
        Objects.requireNonNull(urlTemplate, "urlTemplate must not be null");
        Objects.requireNonNull(normalizedTemplate, "normalizedTemplate must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        builderParameters = builderParameters == null || builderParameters.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builderParameters));
    }

    /** Whether the request's HTTP method is accepted. */
    public boolean acceptsMethod(HttpMethod requestMethod) {
        return method == null || method == requestMethod;
    }

    /**
     * This expectation with its template normalized against another base-URL marker. Only a
     * template that starts with {@code baseUrlMarker} is normalized again, so a marker given to
     * the builder is kept.
     *
     * @param baseUrlMarker the marker to strip; null or empty leaves the expectation as it is
     * @return {@code this} when the normalized template is unchanged, otherwise a copy
     */
    public Expectation normalizedWith(String baseUrlMarker) {
        if (baseUrlMarker == null || baseUrlMarker.isEmpty() || !urlTemplate.startsWith(baseUrlMarker)) {
            return this;
        }
        String normalized = TemplateNormalizer.normalize(urlTemplate, baseUrlMarker);
        if (normalized.equals(normalizedTemplate)) {
            return this;
        }
        return new Expectation(
                method, urlTemplate, normalized, strategy, builderParameters, kind, responseType, outcome, predicate);
    }

    /** Short description used in logs and diagnostics. */
    public String describe() {
        return (method != null ? method.name() : "ANY")
                + " " + urlTemplate
                + " [" + strategy.canonical().name().toLowerCase(Locale.ROOT) + ", " + kind.name().toLowerCase(Locale.ROOT)
                + (responseType != null ? " " + responseType.getSimpleName() : "")
                + "]";
    }

    /**
     * Starts an expectation matched by normalized template.
     *
     * @param method   the method, or null for any
     * @param template the template, e.g. {@code /api/funds/{fundId}}
     */
    public static Builder forTemplate(HttpMethod method, String template) {
        return new Builder(method, template, MatchStrategy.TEMPLATE);
    }

    /**
     * Starts an expectation bound to one builder's template and path parameter values.
     *
     * @param method            the method
     * @param builderTemplate   the builder's raw template
     * @param builderParameters the builder's path parameters
     */
    public static Builder forBuilder(HttpMethod method, String builderTemplate, Map<String, ?> builderParameters) {
        Builder builder = new Builder(method, builderTemplate, MatchStrategy.BUILDER);
        builder.builderParameters.putAll(builderParameters);
        return builder;
    }

    /** Builder for {@link Expectation}. */
    public static final class Builder {

        private final HttpMethod method;
        private final String urlTemplate;
        private MatchStrategy strategy;
        private final Map<String, Object> builderParameters = new LinkedHashMap<>();
        private ResponseKind kind = ResponseKind.OBJECT;
        private Class<?> responseType;
        private Outcome outcome = Outcome.empty();
        private RequestPredicate predicate;
        private String baseUrlMarker = TemplateNormalizer.DEFAULT_BASE_URL_MARKER;

        Builder(HttpMethod method, String urlTemplate, MatchStrategy strategy) {
            this.method = method;
            this.urlTemplate = urlTemplate == null ? "" : urlTemplate;
            this.strategy = strategy;
        }

        public Builder strategy(MatchStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder kind(ResponseKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder responseType(Class<?> responseType) {
            this.responseType = responseType;
            return this;
        }

        public Builder returning(Object value) {
            this.outcome = Outcome.returning(value);
            return this;
        }

        public Builder throwing(RuntimeException error) {
            this.outcome = Outcome.throwing(error);
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder when(RequestPredicate predicate) {
            this.predicate = predicate;
            return this;
        }

        /** Marker stripped when computing the normalized template. */
        public Builder baseUrlMarker(String baseUrlMarker) {
            this.baseUrlMarker = baseUrlMarker;
            return this;
        }

        public Expectation build() {
            return new Expectation(
                    method,
                    urlTemplate,
                    TemplateNormalizer.normalize(urlTemplate, baseUrlMarker),
                    strategy,
                    builderParameters,
                    kind,
                    responseType,
                    outcome,
                    predicate);
        }
    }
}
