package io.clientmock.core.engine;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.error.ParameterNotFoundException;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.MatchResult;
import io.clientmock.core.model.MatchStrategy;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.predicate.NamedPredicate;
import io.clientmock.core.predicate.RequestPredicate;
import io.clientmock.core.predicate.RequestPredicates;
import io.clientmock.core.template.TemplateNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a simulated request satisfies an {@link Expectation}.
 *
 * <p>Evaluation order (short-circuit): method, then template, then the extra predicate. The
 * predicate is the most expensive check and the only one that runs user code, so it only runs
 * for requests that already passed the envelope checks.
 *
 * <p>Template check per strategy:
 * <ul>
 * <li>{@link MatchStrategy#TEMPLATE}: the request template, normalized, equals the expectation's
 * normalized template. Under {@link MockSettings.QueryMatching#LENIENT}, the request's query
 * fragment is ignored when the expectation declares none. A blank request template never
 * matches.</li>
 * <li>{@link MatchStrategy#BUILDER}: the request template equals the builder's raw template and
 * every builder path parameter (except the ignored ones, {@code baseurl} by default) is present
 * under the same key with the same string form. {@code null} compares as the empty string.</li>
 * </ul>
 *
 * <p>If the extra predicate throws {@link ParameterNotFoundException} the exception propagates,
 * since it tells the test author which parameter name to use. Any other runtime exception is
 * logged at WARN and treated as a mismatch.
 *
 * <p>Stateless and thread-safe.
 */
public final class RequestMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RequestMatcher.class);

    private RequestMatcher() {}

    /** Whether the request satisfies the expectation under default settings. */
    public static boolean matches(Expectation expectation, RequestDescriptor request) {
        return evaluate(expectation, request, MockSettings.defaults()).matched();
    }

    /**
     * Evaluates every check and reports the first failing one.
     *
     * @param expectation the registered expectation
     * @param request     the simulated request
     * @param settings    comparison settings
     * @return {@link MatchResult#success()}, or a mismatch naming the failed check
     * @throws ParameterNotFoundException if the extra predicate looks up an unknown parameter
     */
    public static MatchResult evaluate(Expectation expectation, RequestDescriptor request, MockSettings settings) {
        String reason = methodMismatch(expectation, request);
        if (reason == null) {
            reason = templateMismatch(expectation, request, settings);
        }
        if (reason == null) {
            reason = predicateMismatch(expectation, request);
        }
        if (reason != null) {
            LOG.debug("Expectation {} rejected {} {}: {}",
                    expectation.describe(), request.method(), request.urlTemplate(), reason);
            return MatchResult.mismatch(reason);
        }
        return MatchResult.success();
    }

    /**
     * The checks of {@link #evaluate} as a single inspectable predicate, for mocking back ends
     * that take a matcher object.
     *
     * @return a conjunction of the method, template and extra-predicate checks
     */
    public static RequestPredicate asPredicate(Expectation expectation, MockSettings settings) {
        List<RequestPredicate> checks = new ArrayList<>();
        if (expectation.method() != null) {
            checks.add(new NamedPredicate(
                    "method == " + expectation.method(),
                    request -> methodMismatch(expectation, request) == null));
        }
        String label = expectation.strategy().canonical() == MatchStrategy.BUILDER
                ? "builder == " + expectation.urlTemplate() + " " + expectation.builderParameters()
                : "template ~ " + expectation.normalizedTemplate();
        checks.add(new NamedPredicate(label, request -> templateMismatch(expectation, request, settings) == null));
        if (expectation.predicate() != null) {
            checks.add(new NamedPredicate(
                    expectation.predicate().describe(),
                    request -> predicateMismatch(expectation, request) == null));
        }
        return RequestPredicates.and(checks);
    }

    private static String methodMismatch(Expectation expectation, RequestDescriptor request) {
        if (expectation.acceptsMethod(request.method())) {
            return null;
        }
        return "method: expected " + expectation.method() + " but was " + request.method();
    }

    private static String templateMismatch(Expectation expectation, RequestDescriptor request, MockSettings settings) {
        String actual = request.urlTemplate();
        if (actual == null || actual.isBlank()) {
            return "template: request template is blank";
        }
        MatchStrategy strategy = expectation.strategy();
        if (strategy.isDeprecated()) {
            LOG.warn("Match strategy {} is deprecated and behaves as {} (expectation {})",
                    strategy, strategy.canonical(), expectation.describe());
        }
        if (strategy.canonical() == MatchStrategy.BUILDER) {
            return builderMismatch(expectation, request, settings);
        }

        String expected = expectation.normalizedTemplate();
        String normalized = TemplateNormalizer.normalize(actual, settings.baseUrlMarker());
        if (settings.queryMatching() == MockSettings.QueryMatching.LENIENT
                && !TemplateNormalizer.hasQueryFragment(expected)) {
            normalized = TemplateNormalizer.stripQueryFragments(normalized);
        }
        boolean equal = settings.ignoreCase() ? normalized.equalsIgnoreCase(expected) : normalized.equals(expected);
        return equal ? null : "template: expected " + expected + " but was " + normalized;
    }

    private static String builderMismatch(Expectation expectation, RequestDescriptor request, MockSettings settings) {
        String expected = expectation.urlTemplate();
        String actual = request.urlTemplate();
        boolean sameTemplate = settings.ignoreCase() ? actual.equalsIgnoreCase(expected) : actual.equals(expected);
        if (!sameTemplate) {
            return "template: expected builder template " + expected + " but was " + actual;
        }
        Map<String, Object> actualParameters = request.pathParameters();
        for (Map.Entry<String, Object> entry : expectation.builderParameters().entrySet()) {
            String key = entry.getKey();
            if (isIgnored(key, settings)) {
                continue;
            }
            if (!actualParameters.containsKey(key)) {
                return "path parameter '" + key + "': missing from request";
            }
            String expectedValue = stringOf(entry.getValue());
            String actualValue = stringOf(actualParameters.get(key));
            if (!expectedValue.equals(actualValue)) {
                return "path parameter '" + key + "': expected \"" + expectedValue + "\" but was \"" + actualValue
                        + "\"";
            }
        }
        return null;
    }

    private static String predicateMismatch(Expectation expectation, RequestDescriptor request) {
        RequestPredicate predicate = expectation.predicate();
        if (predicate == null) {
            return null;
        }
        try {
            return predicate.test(request) ? null : "predicate: " + predicate.describe() + " was false";
        } catch (ParameterNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Predicate {} of expectation {} threw {}, treating as no match: {}",
                    predicate.describe(), expectation.describe(), e.getClass().getSimpleName(), e.getMessage());
            return "predicate: " + predicate.describe() + " threw " + e.getClass().getSimpleName();
        }
    }

    private static boolean isIgnored(String key, MockSettings settings) {
        for (String ignored : settings.ignoredParameters()) {
            if (ignored.equalsIgnoreCase(key)) {
                return true;
            }
        }
        return false;
    }

    private static String stringOf(Object value) {
        return value == null ? "" : value.toString();
    }
}
