package io.webendpoint.core.spi;

/**
 * Server adapter SPI. Bridges the lifecycle manager and the HTTP server implementation that owns
 * sockets, connections and request parsing.
 *
 * <p>
 * One adapter instance serves every endpoint of the process. Listeners are identified by the
 * scheme-qualified id carried in {@link ListenerSpec#listenerId()}, which is also the key for
 * {@link #stopListener(String)}.
 *
 * <p>
 * Calls are synchronous: {@code startListener} returns once the socket is bound or fails, and
 * {@code stopListener} returns once the listener is shut down. Timeouts, if wanted, are the
 * caller's concern.
 */
public interface ServerAdapter {

    /** Short adapter name used in status lines (e.g. {@code Javalin}). */
    String name();

    /**
     * Binds a listener.
     *
     * @param spec the listener to start
     * @return a handle for the bound listener
     * @throws AddressInUseException if the requested address is already bound
     * @throws RuntimeException      for any other start failure
     */
    ListenerHandle startListener(ListenerSpec spec);

    /**
     * Shuts down a listener. Best-effort: unknown or already stopped ids are a no-op.
     *
     * @param listenerId scheme-qualified listener id
     */
    void stopListener(String listenerId);
}
