package io.clientmock.mockito;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.engine.RequestMatcher;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.predicate.RequestPredicate;
import io.clientmock.core.predicate.RequestPredicates;
import java.util.Objects;
import org.mockito.ArgumentMatcher;

/**
 * Compiles {@link RequestPredicate}s into Mockito {@link ArgumentMatcher}s, for stubbing and for
 * {@code verify(...)}.
 *
 * <pre>{@code
 * verify(MockableClients.dispatcherOf(client))
 *         .send(argThat(RequestMatchers.request(HttpMethod.GET, "/api/funds/{id}")), any());
 * }</pre>
 *
 * <p>A matcher's {@code toString()} is the predicate's description, so Mockito's "arguments are
 * different" output shows the condition that was expected.
 */
public final class RequestMatchers {

    private RequestMatchers() {}

    /** A matcher accepting the requests {@code predicate} accepts; never matches {@code null}. */
    public static ArgumentMatcher<RequestDescriptor> matching(RequestPredicate predicate) {
        return new PredicateMatcher(Objects.requireNonNull(predicate, "predicate must not be null"));
    }

    /**
     * A matcher on method and structural template under {@link MockSettings#defaults()}.
     *
     * @param method   the method, or null for any
     * @param template e.g. {@code /api/funds/{fundId}}
     */
    public static ArgumentMatcher<RequestDescriptor> request(HttpMethod method, String template) {
        return request(method, template, MockSettings.defaults());
    }

    /**
     * A matcher on method and structural template, comparing templates the way a client created
     * with {@code settings} does. For a client from {@link MockableClients}, pass
     * {@code MockableClients.engineOf(dispatcher).settings()}.
     *
     * @param method   the method, or null for any
     * @param template e.g. {@code /api/funds/{fundId}}
     * @param settings base-URL marker, case and query matching to apply
     */
    public static ArgumentMatcher<RequestDescriptor> request(
            HttpMethod method, String template, MockSettings settings) {
        RequestPredicate templateCheck = RequestPredicates.templateMatches(template, settings);
        return matching(method == null ? templateCheck : RequestPredicates.methodIs(method).and(templateCheck));
    }

    /** A matcher applying every check of {@code expectation} under {@code settings}. */
    public static ArgumentMatcher<RequestDescriptor> expectation(Expectation expectation, MockSettings settings) {
        return matching(RequestMatcher.asPredicate(expectation, settings));
    }

    private static final class PredicateMatcher implements ArgumentMatcher<RequestDescriptor> {

        private final RequestPredicate predicate;

        PredicateMatcher(RequestPredicate predicate) {
            this.predicate = predicate;
        }

        @Override
        public boolean matches(RequestDescriptor request) {
            return request != null && predicate.test(request);
        }

        @Override
        public String toString() {
            return predicate.describe();
        }
    }
}
