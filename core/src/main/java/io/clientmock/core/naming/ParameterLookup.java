package io.clientmock.core.naming;

import io.clientmock.core.error.ParameterNotFoundException;
import io.clientmock.core.model.RequestDescriptor;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves logical parameter names against a request's parameter maps using
 * {@link NamingVariations}.
 *
 * <p>A key counts as present when the map contains it, even if its value is {@code null}.
 */
public final class ParameterLookup {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterLookup.class);

    private ParameterLookup() {}

    /**
     * Finds the first variation present in {@code parameters}.
     *
     * @param parameters  the parameter map to search
     * @param name        the logical name
     * @param variations  candidate spellings, in priority order
     * @return the resolved parameter, or empty
     */
    public static Optional<ResolvedParameter> find(
            Map<String, ?> parameters, String name, List<String> variations) {
        for (String candidate : variations) {
            if (parameters.containsKey(candidate)) {
                if (!candidate.equals(name)) {
                    LOG.debug("Resolved parameter '{}' as '{}'", name, candidate);
                }
                return Optional.of(new ResolvedParameter(name, candidate, parameters.get(candidate)));
            }
        }
        return Optional.empty();
    }

    public static Optional<ResolvedParameter> findPathParameter(RequestDescriptor request, String name) {
        return find(request.pathParameters(), name, NamingVariations.forPathParameter(name));
    }

    public static Optional<ResolvedParameter> findQueryParameter(RequestDescriptor request, String name) {
        return find(request.queryParameters(), name, NamingVariations.forQueryParameter(name));
    }

    /**
     * Returns the value of a path parameter by logical name.
     *
     * @throws ParameterNotFoundException listing the tried variations and the available keys
     */
    public static Object requirePathParameter(RequestDescriptor request, String name) {
        List<String> variations = NamingVariations.forPathParameter(name);
        return find(request.pathParameters(), name, variations)
                .orElseThrow(() -> notFound(request, name, ParameterNotFoundException.Kind.PATH, variations))
                .value();
    }

    /**
     * Returns the value of a query parameter by logical name.
     *
     * @throws ParameterNotFoundException listing the tried variations and the available keys
     */
    public static Object requireQueryParameter(RequestDescriptor request, String name) {
        List<String> variations = NamingVariations.forQueryParameter(name);
        return find(request.queryParameters(), name, variations)
                .orElseThrow(() -> notFound(request, name, ParameterNotFoundException.Kind.QUERY, variations))
                .value();
    }

    private static ParameterNotFoundException notFound(
            RequestDescriptor request, String name, ParameterNotFoundException.Kind kind, List<String> variations) {
        Map<String, Object> parameters =
                kind == ParameterNotFoundException.Kind.PATH ? request.pathParameters() : request.queryParameters();
        return new ParameterNotFoundException(
                name,
                kind,
                variations,
                request.urlTemplate(),
                request.normalizedTemplate(),
                NamingVariations.describeKeys(parameters.keySet()));
    }
}
