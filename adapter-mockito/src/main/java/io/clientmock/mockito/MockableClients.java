package io.clientmock.mockito;

import io.clientmock.core.config.MockSettings;
import io.clientmock.core.config.SettingsLoader;
import io.clientmock.core.engine.StubEngine;
import io.clientmock.core.error.InvalidRequestBuilderException;
import io.clientmock.core.spi.RequestBuilder;
import io.clientmock.core.spi.RequestDispatcher;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.WeakHashMap;
import java.util.function.Function;
import org.mockito.MockingDetails;
import org.mockito.Mockito;
import org.mockito.quality.Strictness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates generated clients backed by a Mockito mock {@link RequestDispatcher}, and finds that
 * mock again from any request builder of the client.
 *
 * <pre>{@code
 * TestApiClient client = MockableClients.create(TestApiClient::new);
 * BuilderMocks.mockGet(client.api().funds().byFundId("abc"), Fund.class, fund);
 * }</pre>
 *
 * <p>Each mock dispatcher owns a {@link StubEngine}. Mocks created here carry their engine in
 * their default answer; mocks created elsewhere (for instance with {@code @Mock}) get one on
 * first use, held in a weak map so that it is released together with the mock.
 */
public final class MockableClients {

    private static final Logger LOG = LoggerFactory.getLogger(MockableClients.class);

    private static final Map<RequestDispatcher, StubEngine> FOREIGN_ENGINES =
            Collections.synchronizedMap(new WeakHashMap<>());

    private MockableClients() {}

    /**
     * Builds a client around a fresh mock dispatcher, using settings from
     * {@link SettingsLoader#loadDefault()}.
     *
     * @param factory the client constructor, typically {@code ApiClient::new}
     */
    public static <T> T create(Function<RequestDispatcher, T> factory) {
        return create(factory, SettingsLoader.loadDefault());
    }

    /**
     * Builds a client around a fresh mock dispatcher.
     *
     * @param factory  the client constructor
     * @param settings matching and dispatch settings for this client
     */
    public static <T> T create(Function<RequestDispatcher, T> factory, MockSettings settings) {
        Objects.requireNonNull(factory, "factory must not be null");
        return factory.apply(mockDispatcher(settings));
    }

    /** A mock dispatcher with its own engine. */
    public static RequestDispatcher mockDispatcher(MockSettings settings) {
        StubEngine engine = new StubEngine(settings);
        RequestDispatcher dispatcher = Mockito.mock(
                RequestDispatcher.class,
                Mockito.withSettings().defaultAnswer(new EngineAnswer(engine)).strictness(Strictness.LENIENT));
        LOG.debug("Created mock dispatcher with settings {}", settings);
        return dispatcher;
    }

    /**
     * Returns the mock dispatcher behind a request builder, for {@code verify(...)}.
     *
     * @throws InvalidRequestBuilderException if the builder reports no template or its dispatcher
     *     is not a Mockito mock
     */
    public static RequestDispatcher dispatcherOf(RequestBuilder builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        String template = builder.urlTemplate();
        if (template == null) {
            throw new InvalidRequestBuilderException(
                    "Request builder " + builder.getClass().getName() + " has no URL template", null);
        }
        RequestDispatcher dispatcher = builder.requestDispatcher();
        if (dispatcher == null || !Mockito.mockingDetails(dispatcher).isMock()) {
            throw new InvalidRequestBuilderException(
                    "Request builder for '" + template + "' is not backed by a mock dispatcher. "
                            + "Create the client with MockableClients.create(...)",
                    template);
        }
        return dispatcher;
    }

    /**
     * The engine answering for a mock dispatcher.
     *
     * @throws IllegalArgumentException if {@code dispatcher} is not a Mockito mock
     */
    public static StubEngine engineOf(RequestDispatcher dispatcher) {
        MockingDetails details = Mockito.mockingDetails(dispatcher);
        if (!details.isMock()) {
            throw new IllegalArgumentException("Not a mock dispatcher: " + dispatcher);
        }
        if (details.getMockCreationSettings().getDefaultAnswer() instanceof EngineAnswer answer) {
            return answer.engine();
        }
        return FOREIGN_ENGINES.computeIfAbsent(dispatcher, d -> {
            LOG.debug("Attaching a default-settings engine to externally created mock {}", d);
            return new StubEngine(MockSettings.defaults());
        });
    }
}
