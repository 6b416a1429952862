package io.clientmock.core.spi;

/**
 * Error response raised by a generated client, carrying the HTTP status code.
 *
 * <p>Tests stub failures with it, e.g. a 404 for an unknown resource.
 */
public class ApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int responseStatusCode;

    public ApiException(String message, int responseStatusCode) {
        super(message);
        this.responseStatusCode = responseStatusCode;
    }

    public ApiException(String message, int responseStatusCode, Throwable cause) {
        super(message, cause);
        this.responseStatusCode = responseStatusCode;
    }

    public ApiException(int responseStatusCode) {
        this("API request failed with status " + responseStatusCode, responseStatusCode);
    }

    public int responseStatusCode() {
        return responseStatusCode;
    }
}
