package io.clientmock.core.error;

/**
 * Thrown when mock settings cannot be loaded: unreadable file, invalid YAML or an invalid value.
 */
public final class SettingsLoadException extends ClientMockException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SettingsLoadException(String message, String source) {
        super(message, null, Phase.SETUP);
        this.source = source;
    }

    public SettingsLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.SETUP);
        this.source = source;
    }

    /** The file path or classpath resource that caused the error. */
    public String source() {
        return source;
    }
}
