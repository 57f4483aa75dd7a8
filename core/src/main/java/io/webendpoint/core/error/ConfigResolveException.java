package io.webendpoint.core.error;

/**
 * Thrown when the configuration of an endpoint cannot be resolved: the configuration source
 * failed, or a value is present but invalid (non-numeric port, unknown url scheme, blank host).
 * Resolution failures are never retried.
 */
public class ConfigResolveException extends EndpointException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public ConfigResolveException(String message, String endpointId, String key) {
        super(message, endpointId);
        this.key = key;
    }

    public ConfigResolveException(String message, Throwable cause, String endpointId, String key) {
        super(message, cause, endpointId);
        this.key = key;
    }

    /** The offending configuration key (e.g. {@code http.port}), or {@code null} if not key-specific. */
    public String key() {
        return key;
    }
}
