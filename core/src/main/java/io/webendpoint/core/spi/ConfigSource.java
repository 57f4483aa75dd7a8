package io.webendpoint.core.spi;

import io.webendpoint.core.config.EndpointOverrides;
import java.util.Optional;

/**
 * Read access to per-application, per-endpoint configuration overrides. Implementations may
 * change their answer between calls (runtime updates, file reloads); the lifecycle manager reads
 * the source once per {@code start}.
 */
@FunctionalInterface
public interface ConfigSource {

    /**
     * Returns the overrides for an endpoint.
     *
     * @param appId      owning application id
     * @param endpointId endpoint id
     * @return the overrides, or empty when nothing is configured for the endpoint
     */
    Optional<EndpointOverrides> overrides(String appId, String endpointId);
}
