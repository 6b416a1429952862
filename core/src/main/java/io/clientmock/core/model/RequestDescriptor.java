package io.clientmock.core.model;

import io.clientmock.core.naming.ParameterLookup;
import io.clientmock.core.naming.ResolvedParameter;
import io.clientmock.core.template.TemplateNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only snapshot of one simulated request, as a generated client hands it to its request
 * dispatcher. The engine never mutates it.
 *
 * <p>Parameter maps keep the generator's insertion order and may hold {@code null} values.
 * Their keys are whatever spelling the generator chose ({@code fund-id}, {@code fund%2Did},
 * ...); use {@link #pathParameter(String)} to look a value up by its logical name.
 *
 * @param method          the HTTP method
 * @param urlTemplate     the raw generator template, e.g.
 *                        {@code {+baseurl}/api/funds/{fund%2Did}{?select}}
 * @param pathParameters  path parameter values keyed by generator name
 * @param queryParameters query parameter values keyed by generator name
 * @param headers         request headers
 * @param hasBody         whether the request carries a body
 */
public record RequestDescriptor(
        HttpMethod method,
        String urlTemplate,
        Map<String, Object> pathParameters,
        Map<String, Object> queryParameters,
        HttpHeaders headers,
        boolean hasBody) {

    public RequestDescriptor {
        Objects.requireNonNull(method, "method must not be null");
        pathParameters = copyOf(pathParameters);
        queryParameters = copyOf(queryParameters);
        headers = headers != null ? headers : HttpHeaders.empty();
    }

    /** Request without query parameters, headers or body. */
    public RequestDescriptor(HttpMethod method, String urlTemplate, Map<String, ?> pathParameters) {
        this(method, urlTemplate, copyOf(pathParameters), Map.of(), HttpHeaders.empty(), false);
    }

    /** The template in canonical, name-independent form using the default base-URL marker. */
    public String normalizedTemplate() {
        return TemplateNormalizer.normalize(urlTemplate);
    }

    /**
     * Looks up a path parameter by its logical name, trying every naming variation.
     *
     * @param name logical name, e.g. {@code fundId}
     * @return the value, possibly null if the generator stored a null
     * @throws io.clientmock.core.error.ParameterNotFoundException if no variation is present
     */
    public Object pathParameter(String name) {
        return ParameterLookup.requirePathParameter(this, name);
    }

    /** Looks up a path parameter by logical name without throwing. */
    public Optional<ResolvedParameter> findPathParameter(String name) {
        return ParameterLookup.findPathParameter(this, name);
    }

    /**
     * Looks up a query parameter by its logical name, including OData-style {@code $name}
     * spellings.
     *
     * @throws io.clientmock.core.error.ParameterNotFoundException if no variation is present
     */
    public Object queryParameter(String name) {
        return ParameterLookup.requireQueryParameter(this, name);
    }

    /** Looks up a query parameter by logical name without throwing. */
    public Optional<ResolvedParameter> findQueryParameter(String name) {
        return ParameterLookup.findQueryParameter(this, name);
    }

    public static Builder builder(HttpMethod method, String urlTemplate) {
        return new Builder(method, urlTemplate);
    }

    private static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Builder for {@link RequestDescriptor}. */
    public static final class Builder {

        private final HttpMethod method;
        private final String urlTemplate;
        private final Map<String, Object> pathParameters = new LinkedHashMap<>();
        private final Map<String, Object> queryParameters = new LinkedHashMap<>();
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private boolean hasBody;

        Builder(HttpMethod method, String urlTemplate) {
            this.method = method;
            this.urlTemplate = urlTemplate;
        }

        public Builder pathParameter(String name, Object value) {
            pathParameters.put(name, value);
            return this;
        }

        public Builder pathParameters(Map<String, ?> values) {
            pathParameters.putAll(values);
            return this;
        }

        public Builder queryParameter(String name, Object value) {
            queryParameters.put(name, value);
            return this;
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(boolean present) {
            this.hasBody = present;
            return this;
        }

        public RequestDescriptor build() {
            return new RequestDescriptor(
                    method, urlTemplate, pathParameters, queryParameters, HttpHeaders.ofMulti(headers), hasBody);
        }
    }
}
