package io.webendpoint.core.error;

import io.webendpoint.core.spi.Scheme;

/**
 * Any adapter-reported start failure other than an address already in use. The underlying
 * reason is kept verbatim for diagnostics and the adapter's exception is the cause.
 */
public class ListenerStartFailedException extends ListenerException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public ListenerStartFailedException(String endpointId, Scheme scheme, String reason, Throwable cause) {
        super("Something went wrong while starting endpoint " + endpointId + " (" + scheme.urlScheme() + "): "
                + reason, cause, endpointId, scheme);
        this.reason = reason;
    }

    /** The raw reason reported by the server adapter. */
    public String reason() {
        return reason;
    }
}
