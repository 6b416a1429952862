package io.clientmock.core.model;

import java.util.Objects;

/**
 * What a matched expectation produces: a value to return, or an error to throw.
 *
 * @param value the value to return; may be null
 * @param error the error to throw, or null for a value outcome
 */
public record Outcome(Object value, RuntimeException error) {

    private static final Outcome EMPTY = new Outcome(null, null);

    public Outcome {
        if (value != null && error != null) {
            throw new IllegalArgumentException("an outcome either returns a value or throws, not both");
        }
    }

    /** An outcome returning {@code value}, which may be null. */
    public static Outcome returning(Object value) {
        return value == null ? EMPTY : new Outcome(value, null);
    }

    /** An outcome throwing {@code error}. */
    public static Outcome throwing(RuntimeException error) {
        return new Outcome(null, Objects.requireNonNull(error, "error must not be null"));
    }

    /** An outcome returning nothing, for no-content responses. */
    public static Outcome empty() {
        return EMPTY;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Returns the value, or throws the configured error.
     *
     * @return the configured value, possibly null
     */
    public Object produce() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}
