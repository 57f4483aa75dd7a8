package io.webendpoint.core.config;

/**
 * The {@code url} section: the externally visible scheme, host and port of the endpoint. Every
 * field is optional; unset scheme and port are derived from the listener sections.
 *
 * @param scheme {@code http} or {@code https}, or {@code null}
 * @param host   external host name, or {@code null}
 * @param port   external port, or {@code null}
 */
public record UrlConfig(String scheme, String host, Integer port) {

    public static final String DEFAULT_HOST = "localhost";

    /** Default url section: host {@code localhost}, scheme and port derived. */
    public static final UrlConfig DEFAULT = new UrlConfig(null, DEFAULT_HOST, null);

    /** Creates a url section, coercing the port from an integer or a numeric string. */
    public static UrlConfig of(String scheme, String host, Object port) {
        return new UrlConfig(scheme, host, port == null ? null : Ports.coerce(port));
    }

    /** Overlays {@code override} key by key; its non-null fields win. */
    public UrlConfig overlay(UrlConfig override) {
        if (override == null) {
            return this;
        }
        return new UrlConfig(
                override.scheme != null ? override.scheme : scheme,
                override.host != null ? override.host : host,
                override.port != null ? override.port : port);
    }
}
