package io.webendpoint.javalin.config;

/**
 * Thrown when the standalone configuration cannot be loaded: missing file, invalid YAML, or a
 * missing or invalid field. The message names the offending key where there is one.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
