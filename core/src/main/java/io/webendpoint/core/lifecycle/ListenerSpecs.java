package io.webendpoint.core.lifecycle;

import io.webendpoint.core.config.EndpointConfig;
import io.webendpoint.core.config.ListenerConfig;
import io.webendpoint.core.spi.ListenerSpec;
import io.webendpoint.core.spi.Scheme;

/** Derives the per-scheme {@link ListenerSpec} from a resolved {@link EndpointConfig}. */
public final class ListenerSpecs {

    public static final int DEFAULT_HTTP_PORT = 4000;
    public static final int DEFAULT_HTTPS_PORT = 4040;

    /** Option key carrying the owning application id. */
    public static final String APP_OPTION = "app";

    private ListenerSpecs() {
        // utility class
    }

    /**
     * Builds the spec for one scheme.
     *
     * <p>
     * The plain listener uses the {@code http} section with port 4000 by default. The secure
     * listener uses the {@code https} section laid over the {@code http} section (https wins on
     * conflicts) with port 4040 by default.
     *
     * @throws IllegalStateException if the section for {@code scheme} is disabled
     */
    public static ListenerSpec forScheme(EndpointConfig config, Scheme scheme) {
        ListenerConfig section;
        int defaultPort;
        if (scheme == Scheme.PLAIN) {
            section = config.http();
            defaultPort = DEFAULT_HTTP_PORT;
        } else {
            section = config.https() != null ? config.https().mergedOver(config.http()) : null;
            defaultPort = DEFAULT_HTTPS_PORT;
        }
        if (section == null) {
            throw new IllegalStateException(
                    scheme.urlScheme() + " is not enabled for endpoint '" + config.endpointId() + "'");
        }

        if (config.appId() != null) {
            section = section.withDefault(APP_OPTION, config.appId());
        }
        section = section.withDefault(ListenerConfig.PORT, defaultPort);
        int port = section.port().orElse(defaultPort);

        String endpointId = config.endpointId();
        return new ListenerSpec(
                endpointId,
                scheme.listenerId(endpointId),
                scheme,
                section.host(),
                port,
                endpointId,
                section.withOption(ListenerConfig.PORT, port).options());
    }
}
