package io.webendpoint.javalin.config;

import io.webendpoint.core.config.EndpointOverrides;
import java.util.Map;
import java.util.Optional;

/**
 * Contents of the standalone YAML configuration file.
 *
 * @param appId         application id ({@code app}, env {@code APP_ID})
 * @param endpointId    endpoint started by {@code StandaloneMain} ({@code endpoint}, env
 *                      {@code ENDPOINT_ID})
 * @param loggingFormat json or text ({@code logging.format}, env {@code LOG_FORMAT})
 * @param loggingLevel  root log level ({@code logging.level}, env {@code LOG_LEVEL})
 * @param endpoints     overrides per endpoint id ({@code endpoints.<id>}); the started endpoint
 *                      already carries its environment overrides
 */
public record StandaloneConfig(
        String appId, String endpointId, String loggingFormat, String loggingLevel, Map<String, EndpointOverrides> endpoints) {

    public StandaloneConfig {
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
    }

    /** Overrides configured for an endpoint, if any. */
    public Optional<EndpointOverrides> endpoint(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }
}
