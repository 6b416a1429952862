package io.clientmock.mockito;

import io.clientmock.core.error.InvalidRequestBuilderException;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.HttpMethod;
import io.clientmock.core.model.Outcome;
import io.clientmock.core.model.ResponseKind;
import io.clientmock.core.predicate.RequestPredicate;
import io.clientmock.core.spi.RequestBuilder;
import io.clientmock.core.spi.RequestDispatcher;
import java.util.List;
import java.util.Map;

/**
 * Stubs responses for one specific request builder instance.
 *
 * <p>The stub answers only requests whose template is the builder's own template and whose path
 * parameters carry the builder's values, so two builders for the same endpoint with different
 * ids get independent responses:
 *
 * <pre>{@code
 * BuilderMocks.mockGet(client.api().funds().byFundId("abc"), Fund.class, abc);
 * BuilderMocks.mockGet(client.api().funds().byFundId("xyz"), Fund.class,
 *         new ApiException("Fund not found", 404));
 * }</pre>
 *
 * <p>Every method returns the builder so that the call can be chained into the code under test.
 */
public final class BuilderMocks {

    private BuilderMocks() {}

    // --- GET ---

    public static <B extends RequestBuilder, R> B mockGet(B builder, Class<R> responseType, R response) {
        return mockGet(builder, responseType, response, null);
    }

    /**
     * Stubs a GET returning a single object.
     *
     * @param builder      the request builder, created from a mocked client
     * @param responseType the response type
     * @param response     the value to return
     * @param when         an extra condition, or null
     * @return {@code builder}
     */
    public static <B extends RequestBuilder, R> B mockGet(
            B builder, Class<R> responseType, R response, RequestPredicate when) {
        return install(builder, HttpMethod.GET, ResponseKind.OBJECT, responseType, Outcome.returning(response), when);
    }

    public static <B extends RequestBuilder> B mockGet(B builder, Class<?> responseType, RuntimeException error) {
        return mockGet(builder, responseType, error, null);
    }

    public static <B extends RequestBuilder> B mockGet(
            B builder, Class<?> responseType, RuntimeException error, RequestPredicate when) {
        return install(builder, HttpMethod.GET, ResponseKind.OBJECT, responseType, Outcome.throwing(error), when);
    }

    /**
     * Stubs a GET that throws.
     *
     * @deprecated use {@link #mockGet(RequestBuilder, Class, RuntimeException)}
     */
    @Deprecated
    public static <B extends RequestBuilder> B mockGetException(
            B builder, Class<?> responseType, RuntimeException error) {
        return mockGet(builder, responseType, error, null);
    }

    /**
     * Stubs a GET that throws.
     *
     * @deprecated use {@link #mockGet(RequestBuilder, Class, RuntimeException, RequestPredicate)}
     */
    @Deprecated
    public static <B extends RequestBuilder> B mockGetException(
            B builder, Class<?> responseType, RuntimeException error, RequestPredicate when) {
        return mockGet(builder, responseType, error, when);
    }

    public static <B extends RequestBuilder, R> B mockGetCollection(B builder, Class<R> elementType, List<R> response) {
        return mockGetCollection(builder, elementType, response, null);
    }

    public static <B extends RequestBuilder, R> B mockGetCollection(
            B builder, Class<R> elementType, List<R> response, RequestPredicate when) {
        return install(
                builder, HttpMethod.GET, ResponseKind.COLLECTION, elementType, Outcome.returning(response), when);
    }

    public static <B extends RequestBuilder> B mockGetCollection(
            B builder, Class<?> elementType, RuntimeException error) {
        return mockGetCollection(builder, elementType, error, null);
    }

    public static <B extends RequestBuilder> B mockGetCollection(
            B builder, Class<?> elementType, RuntimeException error, RequestPredicate when) {
        return install(builder, HttpMethod.GET, ResponseKind.COLLECTION, elementType, Outcome.throwing(error), when);
    }

    /** Stubs a GET returning a primitive such as a string. */
    public static <B extends RequestBuilder, R> B mockGetPrimitive(B builder, Class<R> responseType, R value) {
        return mockGetPrimitive(builder, responseType, value, null);
    }

    public static <B extends RequestBuilder, R> B mockGetPrimitive(
            B builder, Class<R> responseType, R value, RequestPredicate when) {
        return install(builder, HttpMethod.GET, ResponseKind.PRIMITIVE, responseType, Outcome.returning(value), when);
    }

    // --- POST ---

    public static <B extends RequestBuilder, R> B mockPost(B builder, Class<R> responseType, R response) {
        return mockPost(builder, responseType, response, null);
    }

    public static <B extends RequestBuilder, R> B mockPost(
            B builder, Class<R> responseType, R response, RequestPredicate when) {
        return install(builder, HttpMethod.POST, ResponseKind.OBJECT, responseType, Outcome.returning(response), when);
    }

    public static <B extends RequestBuilder> B mockPost(B builder, Class<?> responseType, RuntimeException error) {
        return mockPost(builder, responseType, error, null);
    }

    public static <B extends RequestBuilder> B mockPost(
            B builder, Class<?> responseType, RuntimeException error, RequestPredicate when) {
        return install(builder, HttpMethod.POST, ResponseKind.OBJECT, responseType, Outcome.throwing(error), when);
    }

    public static <B extends RequestBuilder, R> B mockPostCollection(
            B builder, Class<R> elementType, List<R> response) {
        return mockPostCollection(builder, elementType, response, null);
    }

    public static <B extends RequestBuilder, R> B mockPostCollection(
            B builder, Class<R> elementType, List<R> response, RequestPredicate when) {
        return install(
                builder, HttpMethod.POST, ResponseKind.COLLECTION, elementType, Outcome.returning(response), when);
    }

    // --- PUT / PATCH ---

    public static <B extends RequestBuilder, R> B mockPut(B builder, Class<R> responseType, R response) {
        return mockPut(builder, responseType, response, null);
    }

    public static <B extends RequestBuilder, R> B mockPut(
            B builder, Class<R> responseType, R response, RequestPredicate when) {
        return install(builder, HttpMethod.PUT, ResponseKind.OBJECT, responseType, Outcome.returning(response), when);
    }

    public static <B extends RequestBuilder> B mockPut(B builder, Class<?> responseType, RuntimeException error) {
        return install(builder, HttpMethod.PUT, ResponseKind.OBJECT, responseType, Outcome.throwing(error), null);
    }

    public static <B extends RequestBuilder, R> B mockPatch(B builder, Class<R> responseType, R response) {
        return mockPatch(builder, responseType, response, null);
    }

    public static <B extends RequestBuilder, R> B mockPatch(
            B builder, Class<R> responseType, R response, RequestPredicate when) {
        return install(builder, HttpMethod.PATCH, ResponseKind.OBJECT, responseType, Outcome.returning(response), when);
    }

    public static <B extends RequestBuilder> B mockPatch(B builder, Class<?> responseType, RuntimeException error) {
        return install(builder, HttpMethod.PATCH, ResponseKind.OBJECT, responseType, Outcome.throwing(error), null);
    }

    // --- DELETE ---

    /** Stubs a DELETE with no response body. */
    public static <B extends RequestBuilder> B mockDelete(B builder) {
        return mockDelete(builder, (RequestPredicate) null);
    }

    public static <B extends RequestBuilder> B mockDelete(B builder, RequestPredicate when) {
        return install(builder, HttpMethod.DELETE, ResponseKind.NO_CONTENT, null, Outcome.empty(), when);
    }

    public static <B extends RequestBuilder> B mockDelete(B builder, RuntimeException error) {
        return mockDelete(builder, error, null);
    }

    public static <B extends RequestBuilder> B mockDelete(B builder, RuntimeException error, RequestPredicate when) {
        return install(builder, HttpMethod.DELETE, ResponseKind.NO_CONTENT, null, Outcome.throwing(error), when);
    }

    /**
     * Stubs a DELETE with no response body that throws.
     *
     * @deprecated use {@link #mockDelete(RequestBuilder, RuntimeException)}
     */
    @Deprecated
    public static <B extends RequestBuilder> B mockDeleteException(B builder, RuntimeException error) {
        return mockDelete(builder, error, null);
    }

    /**
     * Stubs a DELETE with no response body that throws.
     *
     * @deprecated use {@link #mockDelete(RequestBuilder, RuntimeException, RequestPredicate)}
     */
    @Deprecated
    public static <B extends RequestBuilder> B mockDeleteException(
            B builder, RuntimeException error, RequestPredicate when) {
        return mockDelete(builder, error, when);
    }

    /** Stubs a DELETE that returns the deleted object. */
    public static <B extends RequestBuilder, R> B mockDelete(B builder, Class<R> responseType, R response) {
        return install(builder, HttpMethod.DELETE, ResponseKind.OBJECT, responseType, Outcome.returning(response), null);
    }

    public static <B extends RequestBuilder, R> B mockDeleteCollection(
            B builder, Class<R> elementType, List<R> response) {
        return install(
                builder, HttpMethod.DELETE, ResponseKind.COLLECTION, elementType, Outcome.returning(response), null);
    }

    private static <B extends RequestBuilder> B install(
            B builder,
            HttpMethod method,
            ResponseKind kind,
            Class<?> responseType,
            Outcome outcome,
            RequestPredicate when) {
        RequestDispatcher dispatcher = MockableClients.dispatcherOf(builder);
        Map<String, Object> pathParameters = builder.pathParameters();
        if (pathParameters == null) {
            throw new InvalidRequestBuilderException(
                    "Request builder for '" + builder.urlTemplate() + "' has no path parameters",
                    builder.urlTemplate());
        }
        String marker = MockableClients.engineOf(dispatcher).settings().baseUrlMarker();
        Expectation expectation = Expectation.forBuilder(method, builder.urlTemplate(), pathParameters)
                .kind(kind)
                .responseType(responseType)
                .outcome(outcome)
                .when(when)
                .baseUrlMarker(marker)
                .build();
        DispatcherStubber.install(dispatcher, expectation);
        return builder;
    }
}
