package io.webendpoint.core.spi;

/**
 * Thrown by a {@link ServerAdapter} when the listener's address is already bound. Any other
 * start failure is reported with an arbitrary runtime exception.
 */
public class AddressInUseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int port;

    public AddressInUseException(int port, String message, Throwable cause) {
        super(message, cause);
        this.port = port;
    }

    /** The port that could not be bound. */
    public int port() {
        return port;
    }
}
