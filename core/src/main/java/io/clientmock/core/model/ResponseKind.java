package io.clientmock.core.model;

/**
 * The dispatcher operation an expectation answers. A stub registered for a single object is not
 * consulted for a collection request to the same endpoint, and vice versa.
 */
public enum ResponseKind {
    /** A single deserialized object. */
    OBJECT,
    /** A list of deserialized objects. */
    COLLECTION,
    /** A primitive value such as a string or a number. */
    PRIMITIVE,
    /** No response body. */
    NO_CONTENT
}
