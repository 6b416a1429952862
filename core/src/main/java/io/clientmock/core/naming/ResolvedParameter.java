package io.clientmock.core.naming;

/**
 * A parameter found by logical name.
 *
 * @param requestedName the logical name that was asked for
 * @param key           the spelling actually present in the request
 * @param value         the value stored under {@code key}; may be null
 */
public record ResolvedParameter(String requestedName, String key, Object value) {

    /** The value's string form; {@code null} becomes the empty string. */
    public String valueAsString() {
        return value == null ? "" : value.toString();
    }
}
