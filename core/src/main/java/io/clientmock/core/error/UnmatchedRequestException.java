package io.clientmock.core.error;

/**
 * Thrown by a stub dispatcher configured to fail on unconfigured calls when no registered
 * expectation matches a request. The message lists every registered expectation together with
 * the reason it was rejected.
 */
public final class UnmatchedRequestException extends ClientMockException {

    private static final long serialVersionUID = 1L;

    public UnmatchedRequestException(String message, String template) {
        super(message, template, Phase.DISPATCH);
    }
}
