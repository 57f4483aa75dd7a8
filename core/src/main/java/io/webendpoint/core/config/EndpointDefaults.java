package io.webendpoint.core.config;

/** Static defaults every endpoint starts from before overrides are applied. */
public final class EndpointDefaults {

    private EndpointDefaults() {
        // utility class
    }

    /**
     * Builds the default configuration: debug errors off, error view derived from the endpoint
     * id, default transports, host {@code localhost}, both listeners disabled, no secret key.
     *
     * @param appId      owning application id
     * @param endpointId endpoint id
     * @return the defaults; no side effects
     */
    public static EndpointConfig build(String appId, String endpointId) {
        return new EndpointConfig(
                appId,
                endpointId,
                false,
                ErrorViews.errorViewFor(endpointId),
                TransportsConfig.DEFAULT,
                UrlConfig.DEFAULT,
                null,
                null,
                null);
    }
}
