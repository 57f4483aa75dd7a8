package io.webendpoint.core.config;

import io.webendpoint.core.spi.ConfigSource;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable, thread-safe {@link ConfigSource} keyed by application and endpoint id. Changes are
 * visible to the next resolution, so values can be swapped at runtime.
 */
public final class InMemoryConfigSource implements ConfigSource {

    private final Map<Key, EndpointOverrides> overrides = new ConcurrentHashMap<>();

    /** Sets the overrides for an endpoint, replacing any previous value. */
    public InMemoryConfigSource put(String appId, String endpointId, EndpointOverrides value) {
        if (value == null) {
            throw new NullPointerException("overrides must not be null");
        }
        overrides.put(new Key(appId, endpointId), value);
        return this;
    }

    /** Removes the overrides for an endpoint; the endpoint falls back to pure defaults. */
    public void remove(String appId, String endpointId) {
        overrides.remove(new Key(appId, endpointId));
    }

    @Override
    public Optional<EndpointOverrides> overrides(String appId, String endpointId) {
        return Optional.ofNullable(overrides.get(new Key(appId, endpointId)));
    }

    private record Key(String appId, String endpointId) {}
}
