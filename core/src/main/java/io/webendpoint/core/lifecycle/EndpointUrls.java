package io.webendpoint.core.lifecycle;

import io.webendpoint.core.config.EndpointConfig;
import io.webendpoint.core.config.ListenerConfig;
import io.webendpoint.core.config.UrlConfig;

/** Canonical external URL of an endpoint. */
public final class EndpointUrls {

    private EndpointUrls() {
        // utility class
    }

    /**
     * Builds the endpoint URL from its configuration. Pure; never touches a listener.
     *
     * <p>
     * Scheme and port come from the first enabled section among {@code https}, {@code http},
     * falling back to {@code http} on port 80. The port is the one the listener binds: an
     * {@code https} section without a port takes the {@code http} port, and a section with no
     * port at all contributes its listener default. The {@code url} section then overrides scheme and port where set, and
     * always supplies the host. Default ports are omitted ({@code https}/443, {@code http}/80).
     */
    public static String url(EndpointConfig config) {
        String scheme;
        int port;
        if (config.httpsEnabled()) {
            scheme = "https";
            port = portOf(config.https().mergedOver(config.http()), ListenerSpecs.DEFAULT_HTTPS_PORT);
        } else if (config.httpEnabled()) {
            scheme = "http";
            port = portOf(config.http(), ListenerSpecs.DEFAULT_HTTP_PORT);
        } else {
            scheme = "http";
            port = 80;
        }

        UrlConfig url = config.url();
        if (url.scheme() != null) {
            scheme = url.scheme();
        }
        if (url.port() != null) {
            port = url.port();
        }
        String host = url.host();

        if (("https".equals(scheme) && port == 443) || ("http".equals(scheme) && port == 80)) {
            return scheme + "://" + host;
        }
        return scheme + "://" + host + ":" + port;
    }

    private static int portOf(ListenerConfig section, int fallback) {
        return section.port().orElse(fallback);
    }
}
