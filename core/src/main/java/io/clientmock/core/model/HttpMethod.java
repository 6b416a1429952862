package io.clientmock.core.model;

import java.util.Locale;

/** HTTP methods a generated client can send. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    TRACE,
    CONNECT;

    /**
     * Parses a method name case-insensitively.
     *
     * @param value the method name, e.g. {@code "get"}
     * @return the matching constant
     * @throws IllegalArgumentException if {@code value} is null or not a known method
     */
    public static HttpMethod parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("HTTP method must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown HTTP method: '" + value + "'", e);
        }
    }
}
