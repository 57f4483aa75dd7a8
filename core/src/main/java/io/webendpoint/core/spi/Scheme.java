package io.webendpoint.core.spi;

/** Listener scheme: plain HTTP or TLS-secured HTTPS. */
public enum Scheme {
    PLAIN("http", "HTTP"),
    SECURE("https", "HTTPS");

    private final String urlScheme;
    private final String listenerSuffix;

    Scheme(String urlScheme, String listenerSuffix) {
        this.urlScheme = urlScheme;
        this.listenerSuffix = listenerSuffix;
    }

    /** The URL scheme served by this listener ({@code http} or {@code https}). */
    public String urlScheme() {
        return urlScheme;
    }

    /**
     * Derives the scheme-qualified listener id for an endpoint, e.g. {@code MyApp.Endpoint.HTTPS}.
     * The same id is used to start and to shut down the listener.
     */
    public String listenerId(String endpointId) {
        return endpointId + "." + listenerSuffix;
    }
}
