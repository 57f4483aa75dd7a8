package io.webendpoint.core.spi;

import java.util.Map;
import java.util.Objects;

/**
 * Per-scheme start request handed to {@link ServerAdapter#startListener(ListenerSpec)}.
 *
 * @param endpointId     the owning endpoint
 * @param listenerId     scheme-qualified id, see {@link Scheme#listenerId(String)}
 * @param scheme         plain or secure
 * @param host           bind address, or {@code null} for all interfaces
 * @param port           resolved port; {@code 0} asks the server for an ephemeral port
 * @param dispatchTarget identifier of the endpoint requests are dispatched to
 * @param options        merged listener options (TLS keys, timeouts, transport options)
 */
public record ListenerSpec(
        String endpointId,
        String listenerId,
        Scheme scheme,
        String host,
        int port,
        String dispatchTarget,
        Map<String, Object> options) {

    public ListenerSpec {
        Objects.requireNonNull(endpointId, "endpointId must not be null");
        Objects.requireNonNull(listenerId, "listenerId must not be null");
        Objects.requireNonNull(scheme, "scheme must not be null");
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    /** Returns an option as text, or {@code null} when absent. */
    public String option(String key) {
        Object value = options.get(key);
        return value != null ? value.toString() : null;
    }
}
