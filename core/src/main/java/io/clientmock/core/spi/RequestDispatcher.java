package io.clientmock.core.spi;

import io.clientmock.core.model.RequestDescriptor;
import java.util.List;

/**
 * The request adapter a generated client sends every request through.
 *
 * <p>A real implementation serializes the request and performs network I/O. In tests the
 * dispatcher is replaced by a stub: either a Mockito mock configured by the
 * {@code adapter-mockito} module, or {@link io.clientmock.core.engine.StubRequestDispatcher}.
 *
 * <p>Each operation corresponds to one {@link io.clientmock.core.model.ResponseKind}.
 */
public interface RequestDispatcher {

    /**
     * Sends a request expecting a single deserialized object.
     *
     * @param request      the request snapshot
     * @param responseType the expected response type
     * @return the response, or {@code null}
     */
    <T> T send(RequestDescriptor request, Class<T> responseType);

    /**
     * Sends a request expecting a collection of deserialized objects.
     *
     * @return the response elements, or {@code null}
     */
    <T> List<T> sendCollection(RequestDescriptor request, Class<T> elementType);

    /**
     * Sends a request expecting a primitive value (string, number, boolean).
     *
     * @return the value, or {@code null}
     */
    <T> T sendPrimitive(RequestDescriptor request, Class<T> responseType);

    /** Sends a request that has no response body. */
    void sendNoContent(RequestDescriptor request);
}
