package io.clientmock.core.spi;

import java.util.Map;

/**
 * What a generated request builder exposes so that a mock can be bound to it.
 *
 * <p>Generated builders usually keep these three values in non-public fields; implementing this
 * interface makes them available without reflection.
 */
public interface RequestBuilder {

    /** The raw template, e.g. {@code {+baseurl}/api/funds/{fund%2Did}{?select}}. */
    String urlTemplate();

    /** Path parameter values keyed by the generator's names, including the base URL entry. */
    Map<String, Object> pathParameters();

    /** The dispatcher this builder sends its requests through. */
    RequestDispatcher requestDispatcher();
}
