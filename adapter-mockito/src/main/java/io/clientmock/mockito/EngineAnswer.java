package io.clientmock.mockito;

import io.clientmock.core.engine.StubEngine;
import io.clientmock.core.model.RequestDescriptor;
import io.clientmock.core.model.ResponseKind;
import org.mockito.Answers;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

/**
 * Answers {@link io.clientmock.core.spi.RequestDispatcher} calls from a {@link StubEngine}.
 *
 * <p>Used both for every installed stub and as the mock's default answer, so the engine's
 * first-registration-wins order and its unmatched policy apply whichever stubbing Mockito picks.
 */
final class EngineAnswer implements Answer<Object> {

    private final StubEngine engine;

    EngineAnswer(StubEngine engine) {
        this.engine = engine;
    }

    StubEngine engine() {
        return engine;
    }

    @Override
    public Object answer(InvocationOnMock invocation) throws Throwable {
        ResponseKind kind = kindOf(invocation.getMethod().getName());
        if (kind == null) {
            return Answers.RETURNS_DEFAULTS.answer(invocation);
        }
        RequestDescriptor request = invocation.getArgument(0);
        Class<?> type = kind == ResponseKind.NO_CONTENT ? null : invocation.getArgument(1);
        return engine.resolve(request, kind, type);
    }

    private static ResponseKind kindOf(String methodName) {
        return switch (methodName) {
            case "send" -> ResponseKind.OBJECT;
            case "sendCollection" -> ResponseKind.COLLECTION;
            case "sendPrimitive" -> ResponseKind.PRIMITIVE;
            case "sendNoContent" -> ResponseKind.NO_CONTENT;
            default -> null;
        };
    }
}
