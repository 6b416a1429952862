package io.clientmock.core.spi;

import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.RequestDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience base for request builders. Holds the template, the accumulated path parameters and
 * the dispatcher, and creates {@link RequestDescriptor}s from them.
 *
 * <p>A navigation step creates the child builder from a copy of the parent's parameters plus the
 * new one, see {@link #withParameter(String, Object)}.
 */
public abstract class BaseRequestBuilder implements RequestBuilder {

    private final String urlTemplate;
    private final Map<String, Object> pathParameters;
    private final RequestDispatcher requestDispatcher;

    protected BaseRequestBuilder(
            String urlTemplate, Map<String, Object> pathParameters, RequestDispatcher requestDispatcher) {
        this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate must not be null");
        this.pathParameters = new LinkedHashMap<>(pathParameters != null ? pathParameters : Map.of());
        this.requestDispatcher = Objects.requireNonNull(requestDispatcher, "requestDispatcher must not be null");
    }

    @Override
    public String urlTemplate() {
        return urlTemplate;
    }

    @Override
    public Map<String, Object> pathParameters() {
        return Collections.unmodifiableMap(pathParameters);
    }

    @Override
    public RequestDispatcher requestDispatcher() {
        return requestDispatcher;
    }

    /** A copy of this builder's path parameters with one more entry, for a child builder. */
    protected Map<String, Object> withParameter(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(pathParameters);
        copy.put(name, value);
        return copy;
    }

    /** A request builder pre-filled with this builder's template and path parameters. */
    protected RequestDescriptor.Builder newRequest(HttpMethod method) {
        return RequestDescriptor.builder(method, urlTemplate).pathParameters(pathParameters);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + urlTemplate + ", " + pathParameters + "]";
    }
}
