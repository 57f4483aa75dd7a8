package io.webendpoint.core.error;

/**
 * Abstract base for all endpoint lifecycle exceptions. Never thrown directly — use the concrete
 * subclasses for configuration, registration and listener failures.
 */
public abstract class EndpointException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String endpointId;

    protected EndpointException(String message, String endpointId) {
        super(message);
        this.endpointId = endpointId;
    }

    protected EndpointException(String message, Throwable cause, String endpointId) {
        super(message, cause);
        this.endpointId = endpointId;
    }

    /** The endpoint that triggered the error, or {@code null} if not yet identified. */
    public String endpointId() {
        return endpointId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
