package io.clientmock.core.error;

/**
 * Thrown when a request builder cannot be used to register a mock: its template or path
 * parameters are missing, or it is not backed by a mockable dispatcher.
 */
public final class InvalidRequestBuilderException extends ClientMockException {

    private static final long serialVersionUID = 1L;

    public InvalidRequestBuilderException(String message, String template) {
        super(message, template, Phase.SETUP);
    }
}
