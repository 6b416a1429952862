package io.clientmock.mockito;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;

import io.clientmock.core.engine.StubEngine;
import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.spi.RequestDispatcher;
import org.mockito.ArgumentMatcher;
import org.mockito.stubbing.Stubber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers an expectation with a dispatcher's engine and installs the matching Mockito stub.
 *
 * <p>Stubs use {@code doAnswer(..).when(..)} so that installing one never invokes the stubs
 * installed before it. They are lenient: under strict stubbing, a request no stub matches still
 * reaches the mock's default answer, and a stub the test never exercises is not an error.
 */
final class DispatcherStubber {

    private static final Logger LOG = LoggerFactory.getLogger(DispatcherStubber.class);

    private DispatcherStubber() {}

    static void install(RequestDispatcher dispatcher, Expectation expectation) {
        StubEngine engine = MockableClients.engineOf(dispatcher);
        Expectation registered = expectation.normalizedWith(engine.settings().baseUrlMarker());
        engine.register(registered);

        ArgumentMatcher<RequestDescriptor> matcher = RequestMatchers.expectation(registered, engine.settings());
        Stubber stubber = lenient().doAnswer(new EngineAnswer(engine));
        Class<?> type = registered.responseType();
        switch (registered.kind()) {
            case OBJECT -> stubber.when(dispatcher).send(argThat(matcher), typeArgument(type));
            case COLLECTION -> stubber.when(dispatcher).sendCollection(argThat(matcher), typeArgument(type));
            case PRIMITIVE -> stubber.when(dispatcher).sendPrimitive(argThat(matcher), typeArgument(type));
            case NO_CONTENT -> stubber.when(dispatcher).sendNoContent(argThat(matcher));
        }
        LOG.debug("Installed stub for {} on dispatcher {}", registered.describe(), dispatcher);
    }

    @SuppressWarnings("unchecked")
    private static Class<Object> typeArgument(Class<?> type) {
        return type == null ? any() : eq((Class<Object>) type);
    }
}
