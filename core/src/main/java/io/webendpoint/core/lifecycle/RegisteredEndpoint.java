package io.webendpoint.core.lifecycle;

import io.webendpoint.core.config.EndpointConfig;
import io.webendpoint.core.spi.ListenerHandle;
import io.webendpoint.core.spi.Scheme;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry entry for a started endpoint: its resolved configuration and the handles of the
 * listeners bound for it. A handle is recorded only after the adapter reported success.
 */
public final class RegisteredEndpoint {

    private final EndpointConfig config;
    private final Map<Scheme, ListenerHandle> listeners = Collections.synchronizedMap(new EnumMap<>(Scheme.class));

    RegisteredEndpoint(EndpointConfig config) {
        this.config = config;
    }

    public String endpointId() {
        return config.endpointId();
    }

    public EndpointConfig config() {
        return config;
    }

    /** The bound listener for {@code scheme}, if any. */
    public Optional<ListenerHandle> listener(Scheme scheme) {
        return Optional.ofNullable(listeners.get(scheme));
    }

    /** Snapshot of all bound listeners. */
    public Map<Scheme, ListenerHandle> listeners() {
        synchronized (listeners) {
            return listeners.isEmpty() ? Map.of() : Map.copyOf(listeners);
        }
    }

    /** External URL of this endpoint, see {@link EndpointUrls#url(EndpointConfig)}. */
    public String url() {
        return EndpointUrls.url(config);
    }

    void bound(ListenerHandle handle) {
        listeners.put(handle.scheme(), handle);
    }

    @Override
    public String toString() {
        return "RegisteredEndpoint[" + config.endpointId() + ", listeners=" + listeners() + "]";
    }
}
