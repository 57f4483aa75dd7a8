package io.webendpoint.core.config;

/**
 * Resolved configuration of one endpoint: defaults from {@link EndpointDefaults} with the
 * overrides of a {@link io.webendpoint.core.spi.ConfigSource} laid over them.
 *
 * @param appId         owning application id
 * @param endpointId    endpoint id, also the key in the endpoint registry
 * @param debugErrors   render debug error pages instead of the error view
 * @param renderErrors  error view target, see {@link ErrorViews}
 * @param transports    transport defaults
 * @param url           external url section
 * @param http          plain listener section, or {@code null} when disabled
 * @param https         secure listener section, or {@code null} when disabled
 * @param secretKeyBase secret used to derive signing keys, or {@code null}
 */
public record EndpointConfig(
        String appId,
        String endpointId,
        boolean debugErrors,
        String renderErrors,
        TransportsConfig transports,
        UrlConfig url,
        ListenerConfig http,
        ListenerConfig https,
        String secretKeyBase) {

    public EndpointConfig {
        if (http != null && !http.enabled()) {
            http = null;
        }
        if (https != null && !https.enabled()) {
            https = null;
        }
    }

    public boolean httpEnabled() {
        return http != null;
    }

    public boolean httpsEnabled() {
        return https != null;
    }

    /** True if at least one listener section is enabled. */
    public boolean serves() {
        return http != null || https != null;
    }

    @Override
    public String toString() {
        // secretKeyBase is never printed
        return "EndpointConfig[appId=" + appId + ", endpointId=" + endpointId + ", debugErrors=" + debugErrors
                + ", renderErrors=" + renderErrors + ", transports=" + transports + ", url=" + url + ", http=" + http
                + ", https=" + https + ", secretKeyBase=" + (secretKeyBase == null ? "unset" : "***") + "]";
    }
}
