package io.clientmock.core.engine;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.model.ResponseKind;
import io.clientmock.core.spi.RequestDispatcher;
import java.util.List;
import java.util.Objects;

/**
 * A {@link RequestDispatcher} that answers from a {@link StubEngine}, for tests that do not use
 * a mocking library.
 *
 * <pre>{@code
 * StubRequestDispatcher dispatcher = new StubRequestDispatcher();
 * dispatcher.expect(Expectation.forTemplate(HttpMethod.GET, "/api/funds/{fundId}")
 *         .responseType(Fund.class)
 *         .returning(fund)
 *         .build());
 * TestApiClient client = new TestApiClient(dispatcher);
 * }</pre>
 */
public final class StubRequestDispatcher implements RequestDispatcher {

    private final StubEngine engine;

    public StubRequestDispatcher() {
        this(new StubEngine());
    }

    public StubRequestDispatcher(MockSettings settings) {
        this(new StubEngine(settings));
    }

    public StubRequestDispatcher(StubEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public StubEngine engine() {
        return engine;
    }

    /** Registers an expectation on the backing engine. */
    public StubRequestDispatcher expect(Expectation expectation) {
        engine.register(expectation);
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T send(RequestDescriptor request, Class<T> responseType) {
        return (T) engine.resolve(request, ResponseKind.OBJECT, responseType);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> sendCollection(RequestDescriptor request, Class<T> elementType) {
        return (List<T>) engine.resolve(request, ResponseKind.COLLECTION, elementType);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T sendPrimitive(RequestDescriptor request, Class<T> responseType) {
        return (T) engine.resolve(request, ResponseKind.PRIMITIVE, responseType);
    }

    @Override
    public void sendNoContent(RequestDescriptor request) {
        engine.resolve(request, ResponseKind.NO_CONTENT, null);
    }
}
