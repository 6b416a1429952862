package io.clientmock.core.error;

/**
 * Abstract base for all client-mock exceptions. Never thrown directly; use one of the concrete
 * subclasses.
 */
public abstract class ClientMockException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** While a test configures mocks (settings, builders, expectations). */
        SETUP,
        /** While the code under test sends a simulated request. */
        DISPATCH
    }

    private final String template;
    private final Phase phase;

    protected ClientMockException(String message, String template, Phase phase) {
        super(message);
        this.template = template;
        this.phase = phase;
    }

    protected ClientMockException(String message, Throwable cause, String template, Phase phase) {
        super(message, cause);
        this.template = template;
        this.phase = phase;
    }

    /** The URL template involved in the error, or {@code null} if none applies. */
    public String template() {
        return template;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
