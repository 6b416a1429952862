package io.clientmock.core.predicate;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.naming.ParameterLookup;
import io.clientmock.core.template.TemplateNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Factories for {@link RequestPredicate}s.
 *
 * <p>Parameter predicates resolve names through the naming variations, so
 * {@code pathParameterEquals("fundId", id)} works whether the generator used {@code fundId},
 * {@code fund-id} or {@code fund%2Did}. A name that resolves to nothing raises
 * {@link io.clientmock.core.error.ParameterNotFoundException} rather than quietly failing.
 */
public final class RequestPredicates {

    private static final RequestPredicate ALWAYS = new NamedPredicate("true", request -> true);

    private RequestPredicates() {}

    /** A predicate that accepts every request. */
    public static RequestPredicate always() {
        return ALWAYS;
    }

    /** Wraps a plain function; described as {@code <lambda>}. */
    public static RequestPredicate of(Predicate<RequestDescriptor> condition) {
        return new NamedPredicate("<lambda>", condition);
    }

    /** Wraps a plain function with a description. */
    public static RequestPredicate of(String description, Predicate<RequestDescriptor> condition) {
        return new NamedPredicate(description, condition);
    }

    /**
     * {@code first AND second}. Either operand may be null, in which case the other is returned.
     *
     * @return a {@link Conjunction}, or the non-null operand
     */
    public static RequestPredicate and(RequestPredicate first, RequestPredicate second) {
        if (first == null) {
            return Objects.requireNonNull(second, "at least one operand is required");
        }
        if (second == null) {
            return first;
        }
        return new Conjunction(List.of(first, second));
    }

    /** Conjunction of all non-null operands, in order. */
    public static RequestPredicate and(List<RequestPredicate> operands) {
        List<RequestPredicate> present = new ArrayList<>();
        for (RequestPredicate operand : operands) {
            if (operand != null) {
                present.add(operand);
            }
        }
        if (present.isEmpty()) {
            return ALWAYS;
        }
        return present.size() == 1 ? present.get(0) : new Conjunction(present);
    }

    public static RequestPredicate methodIs(HttpMethod method) {
        Objects.requireNonNull(method, "method must not be null");
        return new NamedPredicate("method == " + method, request -> request.method() == method);
    }

    /**
     * Structural template match under {@link MockSettings#defaults()}: the {@code {+baseurl}}
     * marker, case-insensitive literals, and the request's query fragment ignored when
     * {@code template} has none.
     *
     * @param template e.g. {@code /api/funds/{fundId}}
     */
    public static RequestPredicate templateMatches(String template) {
        return templateMatches(template, MockSettings.defaults());
    }

    /**
     * Structural template match using the base-URL marker, case handling and query matching of
     * {@code settings}, as a mocked client configured with them compares templates.
     *
     * @param template e.g. {@code /api/funds/{fundId}}
     * @param settings the comparison settings
     */
    public static RequestPredicate templateMatches(String template, MockSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        String marker = settings.baseUrlMarker();
        String expected = TemplateNormalizer.normalize(template, marker);
        boolean ignoreQuery = settings.queryMatching() == MockSettings.QueryMatching.LENIENT
                && !TemplateNormalizer.hasQueryFragment(expected);
        boolean ignoreCase = settings.ignoreCase();
        return new NamedPredicate("template ~ " + expected, request -> {
            if (request.urlTemplate() == null || request.urlTemplate().isBlank()) {
                return false;
            }
            String actual = TemplateNormalizer.normalize(request.urlTemplate(), marker);
            if (ignoreQuery) {
                actual = TemplateNormalizer.stripQueryFragments(actual);
            }
            return ignoreCase ? actual.equalsIgnoreCase(expected) : actual.equals(expected);
        });
    }

    /**
     * The path parameter named {@code name} (under any naming variation) has string form
     * {@code expected}.
     */
    public static RequestPredicate pathParameterEquals(String name, Object expected) {
        String expectedText = stringOf(expected);
        return new NamedPredicate(
                "pathParameter[" + name + "] == \"" + expectedText + "\"",
                request -> expectedText.equals(stringOf(ParameterLookup.requirePathParameter(request, name))));
    }

    /**
     * The query parameter named {@code name} (under any naming variation) has string form
     * {@code expected}.
     */
    public static RequestPredicate queryParameterEquals(String name, Object expected) {
        String expectedText = stringOf(expected);
        return new NamedPredicate(
                "queryParameter[" + name + "] == \"" + expectedText + "\"",
                request -> expectedText.equals(stringOf(ParameterLookup.requireQueryParameter(request, name))));
    }

    public static RequestPredicate headerPresent(String name) {
        return new NamedPredicate("header[" + name + "] present", request -> request.headers().contains(name));
    }

    public static RequestPredicate headerEquals(String name, String value) {
        return new NamedPredicate(
                "header[" + name + "] == \"" + value + "\"",
                request -> request.headers().all(name).contains(value));
    }

    public static RequestPredicate hasBody() {
        return new NamedPredicate("has body", RequestDescriptor::hasBody);
    }

    private static String stringOf(Object value) {
        return value == null ? "" : value.toString();
    }
}
