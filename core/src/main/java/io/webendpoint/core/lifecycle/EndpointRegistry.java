package io.webendpoint.core.lifecycle;

import io.webendpoint.core.config.EndpointConfig;
import io.webendpoint.core.error.EndpointAlreadyRegisteredException;
import io.webendpoint.core.error.EndpointNotRegisteredException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide store of running endpoints, keyed by endpoint id. Injected into the lifecycle
 * manager so that each test can use an isolated instance.
 *
 * <p>
 * Individual operations are thread-safe. Start and stop of the same endpoint must still be
 * serialised by the caller.
 */
public final class EndpointRegistry {

    private final Map<String, RegisteredEndpoint> endpoints = new ConcurrentHashMap<>();

    /**
     * Registers a resolved configuration.
     *
     * @param config the configuration to register
     * @return the new registry entry
     * @throws NullPointerException               if config is null
     * @throws EndpointAlreadyRegisteredException if the endpoint id is already registered; the
     *                                            existing entry is left untouched
     */
    public RegisteredEndpoint register(EndpointConfig config) {
        if (config == null) {
            throw new NullPointerException("config must not be null");
        }
        RegisteredEndpoint entry = new RegisteredEndpoint(config);
        RegisteredEndpoint previous = endpoints.putIfAbsent(config.endpointId(), entry);
        if (previous != null) {
            throw new EndpointAlreadyRegisteredException(config.endpointId());
        }
        return entry;
    }

    /**
     * Looks up a registered endpoint.
     *
     * @param endpointId the endpoint id
     * @return the entry, or empty if not registered
     */
    public Optional<RegisteredEndpoint> lookup(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }

    /**
     * Looks up a registered endpoint, throwing if not found.
     *
     * @throws EndpointNotRegisteredException if no entry exists for the id
     */
    public RegisteredEndpoint require(String endpointId) {
        return lookup(endpointId).orElseThrow(() -> new EndpointNotRegisteredException(endpointId));
    }

    /**
     * Removes an endpoint.
     *
     * @return the removed entry, or empty if it was not registered
     */
    public Optional<RegisteredEndpoint> deregister(String endpointId) {
        return Optional.ofNullable(endpoints.remove(endpointId));
    }

    public boolean isRegistered(String endpointId) {
        return endpoints.containsKey(endpointId);
    }

    /** Returns the number of registered endpoints. */
    public int size() {
        return endpoints.size();
    }
}
