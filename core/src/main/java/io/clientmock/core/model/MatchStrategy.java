package io.clientmock.core.model;

/**
 * How an expectation decides whether a request targets its endpoint.
 */
public enum MatchStrategy {

    /** Positional-token structural equality of normalized templates. Parameter names are ignored. */
    TEMPLATE,

    /**
     * The request template must equal the template of one specific builder instance, and every
     * path parameter of that builder must have the same value in the request.
     */
    BUILDER,

    /**
     * Suffix matching of raw templates.
     *
     * @deprecated a short pattern can match an unrelated nested endpoint; resolves to
     *     {@link #TEMPLATE}.
     */
    @Deprecated
    SUFFIX,

    /**
     * Replacement of every placeholder by one shared wildcard.
     *
     * @deprecated loses parameter positions; resolves to {@link #TEMPLATE}.
     */
    @Deprecated
    WILDCARD;

    /** Returns the strategy actually applied: deprecated aliases map to {@link #TEMPLATE}. */
    @SuppressWarnings("deprecation")
    public MatchStrategy canonical() {
        return this == SUFFIX || this == WILDCARD ? TEMPLATE : this;
    }

    /** {@code true} for the deprecated aliases. */
    public boolean isDeprecated() {
        return canonical() != this;
    }
}
