package io.webendpoint.core.config;

import io.webendpoint.core.error.ConfigResolveException;
import io.webendpoint.core.spi.ConfigSource;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines {@link EndpointDefaults} with the overrides of a {@link ConfigSource}.
 *
 * <p>
 * Merge order: overrides win over defaults key by key. Top-level values are replaced as a
 * whole, except the {@code url} section and the transport settings, whose keys are overlaid
 * individually (setting only {@code url.port} keeps the default host). Listener sections are
 * replaced wholesale.
 *
 * <p>
 * The merged configuration is validated before it is returned; invalid values fail with
 * {@link ConfigResolveException} naming the offending key.
 */
public final class ConfigResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigResolver.class);

    private final ConfigSource source;

    public ConfigResolver(ConfigSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Resolves the configuration of an endpoint.
     *
     * @param appId      owning application id
     * @param endpointId endpoint id
     * @return the validated configuration
     * @throws ConfigResolveException if the source fails or a value is invalid
     */
    public EndpointConfig resolve(String appId, String endpointId) {
        if (endpointId == null || endpointId.isBlank()) {
            throw new ConfigResolveException("endpointId must not be null or blank", endpointId, null);
        }
        EndpointConfig defaults = EndpointDefaults.build(appId, endpointId);

        Optional<EndpointOverrides> overrides;
        try {
            overrides = source.overrides(appId, endpointId);
        } catch (ConfigResolveException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigResolveException(
                    "Failed to read configuration for endpoint '" + endpointId + "': " + e.getMessage(),
                    e,
                    endpointId,
                    null);
        }

        EndpointConfig resolved = overlay(defaults, overrides.orElse(EndpointOverrides.none()));
        validate(resolved);
        LOG.debug("Resolved configuration: {}", resolved);
        return resolved;
    }

    /** Lays {@code overrides} over {@code base}. Pure. */
    static EndpointConfig overlay(EndpointConfig base, EndpointOverrides overrides) {
        TransportsConfig transports = new TransportsConfig(
                overrides.longpollerWindowMs() != null
                        ? overrides.longpollerWindowMs()
                        : base.transports().longpollerWindowMs(),
                overrides.websocketSerializer() != null
                        ? overrides.websocketSerializer()
                        : base.transports().websocketSerializer());

        return new EndpointConfig(
                base.appId(),
                base.endpointId(),
                overrides.debugErrors() != null ? overrides.debugErrors() : base.debugErrors(),
                overrides.renderErrors() != null ? overrides.renderErrors() : base.renderErrors(),
                transports,
                base.url().overlay(overrides.url()),
                overrides.http() != null ? overrides.http() : base.http(),
                overrides.https() != null ? overrides.https() : base.https(),
                overrides.secretKeyBase() != null ? overrides.secretKeyBase() : base.secretKeyBase());
    }

    private static void validate(EndpointConfig config) {
        String endpointId = config.endpointId();

        UrlConfig url = config.url();
        if (url.host() == null || url.host().isBlank()) {
            throw new ConfigResolveException("url.host must not be blank", endpointId, "url.host");
        }
        if (url.scheme() != null && !"http".equals(url.scheme()) && !"https".equals(url.scheme())) {
            throw new ConfigResolveException(
                    "url.scheme must be 'http' or 'https', got '" + url.scheme() + "'", endpointId, "url.scheme");
        }

        validatePort(config.http(), "http", endpointId);
        validatePort(config.https(), "https", endpointId);

        if (config.transports().longpollerWindowMs() <= 0) {
            throw new ConfigResolveException(
                    "transports.longpoller_window_ms must be positive, got "
                            + config.transports().longpollerWindowMs(),
                    endpointId,
                    "transports.longpoller_window_ms");
        }
    }

    private static void validatePort(ListenerConfig section, String name, String endpointId) {
        if (section == null) {
            return;
        }
        try {
            section.port();
        } catch (IllegalArgumentException e) {
            throw new ConfigResolveException(
                    "Invalid " + name + ".port for endpoint '" + endpointId + "': " + e.getMessage(),
                    e,
                    endpointId,
                    name + ".port");
        }
    }
}
