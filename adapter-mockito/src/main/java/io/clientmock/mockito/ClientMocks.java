package io.clientmock.mockito;

import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.Outcome;
import io.clientmock.core.model.ResponseKind;
import io.clientmock.core.predicate.RequestPredicate;
import io.clientmock.core.spi.RequestBuilder;
import io.clientmock.core.spi.RequestDispatcher;
import java.util.List;

/**
 * Stubs responses by URL template, for any request builder of a mocked client.
 *
 * <p>The template is compared structurally: parameter names are ignored, so
 * {@code /api/funds/{fundId}} matches a request generated from
 * {@code {+baseurl}/api/funds/{fund%2Did}{?select}}. Path parameter values are only checked
 * through the optional extra predicate:
 *
 * <pre>{@code
 * ClientMocks.mockResponse(client, "/api/funds/{fundId}", Fund.class, abc,
 *         RequestPredicates.pathParameterEquals("fundId", "abc"));
 * }</pre>
 *
 * <p>Without an explicit method the stub answers any HTTP method. When several stubs match a
 * request, the one registered first answers.
 */
public final class ClientMocks {

    private ClientMocks() {}

    // --- single object ---

    public static <R> void mockResponse(RequestBuilder client, String urlTemplate, Class<R> responseType, R response) {
        mockResponse(client, null, urlTemplate, responseType, response, null);
    }

    public static <R> void mockResponse(
            RequestBuilder client, String urlTemplate, Class<R> responseType, R response, RequestPredicate when) {
        mockResponse(client, null, urlTemplate, responseType, response, when);
    }

    /**
     * Stubs a single-object response.
     *
     * @param client       any request builder of a mocked client
     * @param method       the method to match, or null for any
     * @param urlTemplate  the template to match
     * @param responseType the response type; null matches any requested type
     * @param response     the value to return
     * @param when         an extra condition, or null
     */
    public static <R> void mockResponse(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            Class<R> responseType,
            R response,
            RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.OBJECT, responseType, Outcome.returning(response), when);
    }

    public static void mockResponseException(
            RequestBuilder client, String urlTemplate, Class<?> responseType, RuntimeException error) {
        mockResponseException(client, null, urlTemplate, responseType, error, null);
    }

    public static void mockResponseException(
            RequestBuilder client,
            String urlTemplate,
            Class<?> responseType,
            RuntimeException error,
            RequestPredicate when) {
        mockResponseException(client, null, urlTemplate, responseType, error, when);
    }

    public static void mockResponseException(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            Class<?> responseType,
            RuntimeException error,
            RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.OBJECT, responseType, Outcome.throwing(error), when);
    }

    // --- collection ---

    public static <R> void mockCollectionResponse(
            RequestBuilder client, String urlTemplate, Class<R> elementType, List<R> response) {
        mockCollectionResponse(client, null, urlTemplate, elementType, response, null);
    }

    public static <R> void mockCollectionResponse(
            RequestBuilder client, String urlTemplate, Class<R> elementType, List<R> response, RequestPredicate when) {
        mockCollectionResponse(client, null, urlTemplate, elementType, response, when);
    }

    public static <R> void mockCollectionResponse(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            Class<R> elementType,
            List<R> response,
            RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.COLLECTION, elementType, Outcome.returning(response), when);
    }

    public static void mockCollectionResponseException(
            RequestBuilder client, String urlTemplate, Class<?> elementType, RuntimeException error) {
        mockCollectionResponseException(client, null, urlTemplate, elementType, error, null);
    }

    public static void mockCollectionResponseException(
            RequestBuilder client,
            String urlTemplate,
            Class<?> elementType,
            RuntimeException error,
            RequestPredicate when) {
        mockCollectionResponseException(client, null, urlTemplate, elementType, error, when);
    }

    public static void mockCollectionResponseException(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            Class<?> elementType,
            RuntimeException error,
            RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.COLLECTION, elementType, Outcome.throwing(error), when);
    }

    // --- primitive ---

    public static <R> void mockPrimitiveResponse(
            RequestBuilder client, String urlTemplate, Class<R> responseType, R value) {
        mockPrimitiveResponse(client, null, urlTemplate, responseType, value, null);
    }

    public static <R> void mockPrimitiveResponse(
            RequestBuilder client, String urlTemplate, Class<R> responseType, R value, RequestPredicate when) {
        mockPrimitiveResponse(client, null, urlTemplate, responseType, value, when);
    }

    public static <R> void mockPrimitiveResponse(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            Class<R> responseType,
            R value,
            RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.PRIMITIVE, responseType, Outcome.returning(value), when);
    }

    public static void mockPrimitiveResponseException(
            RequestBuilder client, String urlTemplate, Class<?> responseType, RuntimeException error) {
        mockPrimitiveResponseException(client, null, urlTemplate, responseType, error, null);
    }

    public static void mockPrimitiveResponseException(
            RequestBuilder client,
            String urlTemplate,
            Class<?> responseType,
            RuntimeException error,
            RequestPredicate when) {
        mockPrimitiveResponseException(client, null, urlTemplate, responseType, error, when);
    }

    public static void mockPrimitiveResponseException(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            Class<?> responseType,
            RuntimeException error,
            RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.PRIMITIVE, responseType, Outcome.throwing(error), when);
    }

    // --- no content ---

    public static void mockNoContentResponse(RequestBuilder client, String urlTemplate) {
        mockNoContentResponse(client, null, urlTemplate, null);
    }

    public static void mockNoContentResponse(RequestBuilder client, String urlTemplate, RequestPredicate when) {
        mockNoContentResponse(client, null, urlTemplate, when);
    }

    public static void mockNoContentResponse(
            RequestBuilder client, HttpMethod method, String urlTemplate, RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.NO_CONTENT, null, Outcome.empty(), when);
    }

    public static void mockNoContentResponseException(
            RequestBuilder client, String urlTemplate, RuntimeException error) {
        mockNoContentResponseException(client, null, urlTemplate, error, null);
    }

    public static void mockNoContentResponseException(
            RequestBuilder client, String urlTemplate, RuntimeException error, RequestPredicate when) {
        mockNoContentResponseException(client, null, urlTemplate, error, when);
    }

    public static void mockNoContentResponseException(
            RequestBuilder client, HttpMethod method, String urlTemplate, RuntimeException error, RequestPredicate when) {
        install(client, method, urlTemplate, ResponseKind.NO_CONTENT, null, Outcome.throwing(error), when);
    }

    private static void install(
            RequestBuilder client,
            HttpMethod method,
            String urlTemplate,
            ResponseKind kind,
            Class<?> responseType,
            Outcome outcome,
            RequestPredicate when) {
        RequestDispatcher dispatcher = MockableClients.dispatcherOf(client);
        String marker = MockableClients.engineOf(dispatcher).settings().baseUrlMarker();
        Expectation expectation = Expectation.forTemplate(method, urlTemplate)
                .kind(kind)
                .responseType(responseType)
                .outcome(outcome)
                .when(when)
                .baseUrlMarker(marker)
                .build();
        DispatcherStubber.install(dispatcher, expectation);
    }
}
