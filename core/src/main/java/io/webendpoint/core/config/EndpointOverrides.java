package io.webendpoint.core.config;

/**
 * Partial configuration read from a configuration source. Every field is optional: {@code null}
 * keeps the default. A listener section set to {@link ListenerConfig#disabled()} switches the
 * listener off.
 *
 * <p>
 * Use {@link #builder()} to construct instances.
 *
 * @param debugErrors         overrides {@code debug_errors}
 * @param renderErrors        overrides the error view target
 * @param longpollerWindowMs  overrides {@code transports.longpoller_window_ms}
 * @param websocketSerializer overrides {@code transports.websocket_serializer}
 * @param url                 url fields, overlaid key by key
 * @param http                replaces the plain listener section
 * @param https               replaces the secure listener section
 * @param secretKeyBase       overrides the secret key base
 */
public record EndpointOverrides(
        Boolean debugErrors,
        String renderErrors,
        Long longpollerWindowMs,
        String websocketSerializer,
        UrlConfig url,
        ListenerConfig http,
        ListenerConfig https,
        String secretKeyBase) {

    private static final EndpointOverrides NONE = builder().build();

    /** Overrides that change nothing. */
    public static EndpointOverrides none() {
        return NONE;
    }

    /** Creates a new builder with every field unset. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this instance's fields. */
    public Builder toBuilder() {
        return new Builder()
                .debugErrors(debugErrors)
                .renderErrors(renderErrors)
                .longpollerWindowMs(longpollerWindowMs)
                .websocketSerializer(websocketSerializer)
                .url(url)
                .http(http)
                .https(https)
                .secretKeyBase(secretKeyBase);
    }

    /** Builder for {@link EndpointOverrides}. */
    public static final class Builder {
        private Boolean debugErrors;
        private String renderErrors;
        private Long longpollerWindowMs;
        private String websocketSerializer;
        private UrlConfig url;
        private ListenerConfig http;
        private ListenerConfig https;
        private String secretKeyBase;

        Builder() {}

        public Builder debugErrors(Boolean debugErrors) {
            this.debugErrors = debugErrors;
            return this;
        }

        public Builder renderErrors(String renderErrors) {
            this.renderErrors = renderErrors;
            return this;
        }

        public Builder longpollerWindowMs(Long longpollerWindowMs) {
            this.longpollerWindowMs = longpollerWindowMs;
            return this;
        }

        public Builder websocketSerializer(String websocketSerializer) {
            this.websocketSerializer = websocketSerializer;
            return this;
        }

        public Builder url(UrlConfig url) {
            this.url = url;
            return this;
        }

        public Builder http(ListenerConfig http) {
            this.http = http;
            return this;
        }

        public Builder https(ListenerConfig https) {
            this.https = https;
            return this;
        }

        public Builder secretKeyBase(String secretKeyBase) {
            this.secretKeyBase = secretKeyBase;
            return this;
        }

        public EndpointOverrides build() {
            return new EndpointOverrides(
                    debugErrors,
                    renderErrors,
                    longpollerWindowMs,
                    websocketSerializer,
                    url,
                    http,
                    https,
                    secretKeyBase);
        }
    }
}
