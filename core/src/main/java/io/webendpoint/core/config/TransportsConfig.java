package io.webendpoint.core.config;

/**
 * Transport defaults shared by the endpoint's long-polling and WebSocket transports.
 *
 * @param longpollerWindowMs  how long a long-poll request is held open, in milliseconds
 * @param websocketSerializer id of the serializer used for WebSocket messages
 */
public record TransportsConfig(long longpollerWindowMs, String websocketSerializer) {

    public static final TransportsConfig DEFAULT = new TransportsConfig(10_000, "json");
}
