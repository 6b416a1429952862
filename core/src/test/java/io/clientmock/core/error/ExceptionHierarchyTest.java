package io.clientmock.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy: one abstract root, concrete leaves tagged with the phase in
 * which they occur.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void clientMockExceptionIsAbstractAndRoot() {
        assertThat(ClientMockException.class).isAbstract();
        assertThat(ClientMockException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void concreteExceptionsAreFinalLeaves() {
        for (Class<?> type : List.of(
                ParameterNotFoundException.class,
                UnmatchedRequestException.class,
                InvalidRequestBuilderException.class,
                SettingsLoadException.class)) {
            assertThat(type).isFinal();
            assertThat(type.getSuperclass()).isEqualTo(ClientMockException.class);
        }
    }

    // --- Dispatch-time exceptions ---

    @Test
    void parameterNotFoundIsDispatchPhase() {
        var ex = new ParameterNotFoundException(
                "fundId",
                ParameterNotFoundException.Kind.PATH,
                List.of("fundId", "fund-id"),
                "/api/funds/{id}",
                "/api/funds/{pathParam1}",
                List.of("id"));

        assertThat(ex.phase()).isEqualTo(ClientMockException.Phase.DISPATCH);
        assertThat(ex.template()).isEqualTo("/api/funds/{id}");
        assertThat(ex.normalizedTemplate()).isEqualTo("/api/funds/{pathParam1}");
        assertThat(ex.detail())
                .isEqualTo("Path parameter 'fundId' not found in request for template '/api/funds/{id}' "
                        + "(normalized: '/api/funds/{pathParam1}'). Tried variations: [fundId, fund-id]. "
                        + "Available keys: [id].");
    }

    @Test
    void unmatchedRequestIsDispatchPhase() {
        var ex = new UnmatchedRequestException("no match", "/api/funds/{id}");

        assertThat(ex).isInstanceOf(ClientMockException.class);
        assertThat(ex.phase()).isEqualTo(ClientMockException.Phase.DISPATCH);
        assertThat(ex.template()).isEqualTo("/api/funds/{id}");
    }

    // --- Setup-time exceptions ---

    @Test
    void invalidRequestBuilderIsSetupPhase() {
        var ex = new InvalidRequestBuilderException("not a mock", "/api/funds/{id}");

        assertThat(ex.phase()).isEqualTo(ClientMockException.Phase.SETUP);
        assertThat(ex.detail()).isEqualTo("not a mock");
    }

    @Test
    void settingsLoadKeepsSourceAndCause() {
        var cause = new IllegalArgumentException("bad");
        var ex = new SettingsLoadException("invalid value", cause, "client-mock.yaml");

        assertThat(ex.phase()).isEqualTo(ClientMockException.Phase.SETUP);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.source()).isEqualTo("client-mock.yaml");
        assertThat(ex.template()).isNull();
    }
}
