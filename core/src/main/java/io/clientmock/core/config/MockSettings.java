package io.clientmock.core.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Matching and dispatch settings for one mocked client.
 *
 * <p>Use {@link #defaults()} or {@link #builder()}; {@link SettingsLoader} reads them from YAML
 * with an environment variable overlay.
 *
 * @param baseUrlMarker     prefix stripped from templates before comparison
 * @param ignoreCase        whether template literals compare case-insensitively
 * @param queryMatching     how query fragments take part in template comparison
 * @param ignoredParameters builder path parameters that builder-identity matching skips
 * @param unmatched         what a stub dispatcher does when nothing matches
 */
public record MockSettings(
        String baseUrlMarker,
        boolean ignoreCase,
        QueryMatching queryMatching,
        List<String> ignoredParameters,
        UnmatchedPolicy unmatched) {

    private static final MockSettings DEFAULTS = builder().build();

    /** How query fragments of templates are compared. */
    public enum QueryMatching {
        /**
         * A request's query fragment is ignored when the expectation's template declares none, so
         * {@code /api/funds/{id}} matches {@code {+baseurl}/api/funds/{id}{?select}}. Templates
         * that declare a fragment must match it in arity.
         */
        LENIENT,
        /** Query fragments always take part in the comparison. */
        STRICT;

        /** Parses {@code lenient} / {@code strict}, case-insensitively. */
        public static QueryMatching parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /** What happens when no expectation matches a dispatched request. */
    public enum UnmatchedPolicy {
        /** Return {@code null}, an empty list, or nothing, like an unconfigured mock. */
        RETURN_DEFAULT,
        /** Throw {@link io.clientmock.core.error.UnmatchedRequestException}. */
        FAIL;

        /** Parses {@code return-default} / {@code fail}, case-insensitively. */
        public static UnmatchedPolicy parse(String value) {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        }
    }

    public MockSettings {
        Objects.requireNonNull(baseUrlMarker, "baseUrlMarker must not be null");
        Objects.requireNonNull(queryMatching, "queryMatching must not be null");
        Objects.requireNonNull(unmatched, "unmatched must not be null");
        ignoredParameters = ignoredParameters == null ? List.of() : List.copyOf(ignoredParameters);
    }

    public static MockSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
                .baseUrlMarker(baseUrlMarker)
                .ignoreCase(ignoreCase)
                .queryMatching(queryMatching)
                .ignoredParameters(ignoredParameters)
                .unmatched(unmatched);
    }

    /** Builder for {@link MockSettings}; every field has a default. */
    public static final class Builder {

        private String baseUrlMarker = "{+baseurl}";
        private boolean ignoreCase = true;
        private QueryMatching queryMatching = QueryMatching.LENIENT;
        private List<String> ignoredParameters = List.of("baseurl");
        private UnmatchedPolicy unmatched = UnmatchedPolicy.RETURN_DEFAULT;

        Builder() {}

        public Builder baseUrlMarker(String baseUrlMarker) {
            this.baseUrlMarker = baseUrlMarker;
            return this;
        }

        public Builder ignoreCase(boolean ignoreCase) {
            this.ignoreCase = ignoreCase;
            return this;
        }

        public Builder queryMatching(QueryMatching queryMatching) {
            this.queryMatching = queryMatching;
            return this;
        }

        public Builder ignoredParameters(List<String> ignoredParameters) {
            this.ignoredParameters = ignoredParameters;
            return this;
        }

        public Builder unmatched(UnmatchedPolicy unmatched) {
            this.unmatched = unmatched;
            return this;
        }

        public MockSettings build() {
            return new MockSettings(baseUrlMarker, ignoreCase, queryMatching, ignoredParameters, unmatched);
        }
    }
}
