package io.webendpoint.core.spi;

/**
 * Opaque handle for a bound listener, returned by the server adapter and owned by the lifecycle
 * manager until the endpoint is stopped.
 *
 * @param listenerId scheme-qualified listener id
 * @param scheme     plain or secure
 * @param port       the port actually bound (differs from the requested one for port {@code 0})
 */
public record ListenerHandle(String listenerId, Scheme scheme, int port) {}
