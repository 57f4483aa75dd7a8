package io.webendpoint.core.config;

/** Port coercion shared by listener and url sections. Ports arrive as integers or as text. */
final class Ports {

    static final int MAX_PORT = 65_535;

    private Ports() {
        // utility class
    }

    /**
     * Coerces a configured port to an integer.
     *
     * @param value an {@link Integer}, another integral {@link Number}, or a decimal string
     * @return the port, in {@code 0..65535}
     * @throws IllegalArgumentException if the value is not a valid port
     */
    static int coerce(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("port must not be null");
        }
        long port;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            port = ((Number) value).longValue();
        } else if (value instanceof String text) {
            try {
                port = Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("port is not a number: '" + text + "'", e);
            }
        } else {
            throw new IllegalArgumentException(
                    "port must be an integer or a numeric string, got " + value.getClass().getSimpleName());
        }
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("port out of range 0.." + MAX_PORT + ": " + port);
        }
        return (int) port;
    }
}
