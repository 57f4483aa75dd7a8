package io.webendpoint.core.error;

import io.webendpoint.core.spi.Scheme;

/** The requested port is already bound by another process or listener. */
public class PortInUseException extends ListenerException {

    private static final long serialVersionUID = 1L;

    private final int port;

    public PortInUseException(String endpointId, Scheme scheme, int port, Throwable cause) {
        super("Port " + port + " is already in use", cause, endpointId, scheme);
        this.port = port;
    }

    /** The port that could not be bound. */
    public int port() {
        return port;
    }
}
