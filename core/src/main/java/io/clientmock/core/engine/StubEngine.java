package io.clientmock.core.engine;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.error.ParameterNotFoundException;
import io.clientmock.core.error.UnmatchedRequestException;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.MatchResult;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.model.ResponseKind;
import io.clientmock.core.template.TemplateNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers simulated requests for one mocked client from its registered expectations.
 *
 * <p>Among all expectations that match a request, the one registered first wins. When nothing
 * matches, the {@link MockSettings.UnmatchedPolicy} decides between a default value and an
 * {@link UnmatchedRequestException}.
 *
 * <p>Not thread-safe; one engine per mocked client per test.
 */
public final class StubEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StubEngine.class);

    private final MockSettings settings;
    private final ExpectationRegistry registry;

    public StubEngine() {
        this(MockSettings.defaults());
    }

    public StubEngine(MockSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = new ExpectationRegistry(settings);
    }

    public MockSettings settings() {
        return settings;
    }

    /**
     * Adds an expectation; it is consulted after every expectation registered before it. Its
     * template is normalized again with this engine's base-URL marker, the one requests are
     * normalized with.
     */
    public void register(Expectation expectation) {
        registry.register(expectation.normalizedWith(settings.baseUrlMarker()));
    }

    /** Every registered expectation, in registration order. */
    public List<Expectation> expectations() {
        return registry.all();
    }

    /**
     * Finds the first registered expectation that answers the request.
     *
     * @param request      the simulated request
     * @param kind         the dispatcher operation being invoked
     * @param responseType the response (or element) type requested, or null
     * @return the winning expectation, or empty
     * @throws ParameterNotFoundException if an extra predicate looks up an unknown parameter
     */
    public Optional<Expectation> findMatch(RequestDescriptor request, ResponseKind kind, Class<?> responseType) {
        String normalized = TemplateNormalizer.normalize(request.urlTemplate(), settings.baseUrlMarker());
        for (Expectation candidate : registry.candidatesFor(request.method(), normalized)) {
            if (responseMismatch(candidate, kind, responseType) != null) {
                continue;
            }
            if (RequestMatcher.evaluate(candidate, request, settings).matched()) {
                LOG.debug("Request {} {} answered by {}", request.method(), request.urlTemplate(), candidate.describe());
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Every expectation with its result against the request, ignoring response kind and type. */
    public List<MatchReport> explain(RequestDescriptor request) {
        return explain(request, null, null);
    }

    /**
     * Every expectation with its result against the request, in registration order.
     *
     * @param kind         the dispatcher operation, or null to skip the kind check
     * @param responseType the requested type, or null to skip the type check
     */
    public List<MatchReport> explain(RequestDescriptor request, ResponseKind kind, Class<?> responseType) {
        List<MatchReport> reports = new ArrayList<>();
        for (Expectation expectation : registry.all()) {
            String reason = kind != null ? responseMismatch(expectation, kind, responseType) : null;
            MatchResult result;
            if (reason != null) {
                result = MatchResult.mismatch(reason);
            } else {
                try {
                    result = RequestMatcher.evaluate(expectation, request, settings);
                } catch (ParameterNotFoundException e) {
                    result = MatchResult.mismatch("predicate: " + e.getMessage());
                }
            }
            reports.add(new MatchReport(expectation, result));
        }
        return reports;
    }

    /**
     * Produces the response for a request: the winning expectation's outcome, or the unmatched
     * policy's result.
     *
     * @return the configured value (possibly null); an empty list for an unmatched collection
     *     request under {@link MockSettings.UnmatchedPolicy#RETURN_DEFAULT}; null otherwise
     * @throws RuntimeException the error configured on the winning expectation
     * @throws UnmatchedRequestException under {@link MockSettings.UnmatchedPolicy#FAIL}
     */
    public Object resolve(RequestDescriptor request, ResponseKind kind, Class<?> responseType) {
        Optional<Expectation> match = findMatch(request, kind, responseType);
        if (match.isPresent()) {
            return match.get().outcome().produce();
        }
        if (settings.unmatched() == MockSettings.UnmatchedPolicy.FAIL) {
            throw new UnmatchedRequestException(unmatchedMessage(request, kind, responseType), request.urlTemplate());
        }
        LOG.debug("No expectation for {} {} ({}), returning default", request.method(), request.urlTemplate(), kind);
        return kind == ResponseKind.COLLECTION ? List.of() : null;
    }

    private String unmatchedMessage(RequestDescriptor request, ResponseKind kind, Class<?> responseType) {
        StringBuilder sb = new StringBuilder()
                .append("No expectation matches ")
                .append(request.method())
                .append(' ')
                .append(request.urlTemplate())
                .append(" (")
                .append(kind)
                .append(responseType != null ? " " + responseType.getSimpleName() : "")
                .append(')');
        List<MatchReport> reports = explain(request, kind, responseType);
        if (reports.isEmpty()) {
            sb.append(". No expectations are registered.");
        } else {
            sb.append(". Registered expectations:");
            for (MatchReport report : reports) {
                sb.append("\n  - ").append(report);
            }
        }
        return sb.toString();
    }

    private static String responseMismatch(Expectation expectation, ResponseKind kind, Class<?> responseType) {
        if (expectation.kind() != kind) {
            return "response kind: expected " + expectation.kind() + " but was " + kind;
        }
        if (expectation.responseType() != null
                && responseType != null
                && !expectation.responseType().equals(responseType)) {
            return "response type: expected " + expectation.responseType().getSimpleName() + " but was "
                    + responseType.getSimpleName();
        }
        return null;
    }
}
