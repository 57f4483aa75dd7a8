package io.webendpoint.core.error;

import io.webendpoint.core.spi.Scheme;

/**
 * Abstract parent for listener start failures. Carries the {@link Scheme} of the listener that
 * could not be bound. Both subclasses are fatal for {@code start}.
 */
public abstract class ListenerException extends EndpointException {

    private static final long serialVersionUID = 1L;

    private final Scheme scheme;

    protected ListenerException(String message, Throwable cause, String endpointId, Scheme scheme) {
        super(message, cause, endpointId);
        this.scheme = scheme;
    }

    /** The scheme of the listener that failed to start. */
    public Scheme scheme() {
        return scheme;
    }
}
