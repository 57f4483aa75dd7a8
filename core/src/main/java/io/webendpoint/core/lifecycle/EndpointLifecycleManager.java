package io.webendpoint.core.lifecycle;

import io.webendpoint.core.config.ConfigResolver;
import io.webendpoint.core.config.EndpointConfig;
import io.webendpoint.core.config.EndpointDefaults;
import io.webendpoint.core.error.ListenerException;
import io.webendpoint.core.error.ListenerStartFailedException;
import io.webendpoint.core.error.PortInUseException;
import io.webendpoint.core.spi.AddressInUseException;
import io.webendpoint.core.spi.ListenerHandle;
import io.webendpoint.core.spi.ListenerSpec;
import io.webendpoint.core.spi.Scheme;
import io.webendpoint.core.spi.ServerAdapter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts and stops the listeners of an endpoint.
 *
 * <p>
 * Lifecycle of one endpoint id:
 * <ol>
 * <li>{@link #start}: resolve configuration, register it, bind the plain listener if
 * {@code http} is enabled, then the secure listener if {@code https} is enabled</li>
 * <li>{@link #stop}: shut down every listener enabled in the registered configuration, then
 * deregister</li>
 * </ol>
 * After {@code stop} the endpoint is back in its initial, unregistered state.
 *
 * <p>
 * A failed {@code start} leaves nothing behind: listeners already bound by the call are shut
 * down and the registration is removed before the error propagates, so the supervising process
 * may retry or give up.
 *
 * <p>
 * The manager does no locking of its own. {@code start} and {@code stop} for the same endpoint
 * id must be serialised by the caller.
 */
public final class EndpointLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointLifecycleManager.class);

    private final ConfigResolver resolver;
    private final EndpointRegistry registry;
    private final ServerAdapter adapter;

    public EndpointLifecycleManager(ConfigResolver resolver, EndpointRegistry registry, ServerAdapter adapter) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
    }

    /** Static defaults for an endpoint, see {@link EndpointDefaults#build}. */
    public EndpointConfig buildDefaults(String appId, String endpointId) {
        return EndpointDefaults.build(appId, endpointId);
    }

    /** Defaults with the configuration source's overrides applied, see {@link ConfigResolver}. */
    public EndpointConfig resolveConfig(String appId, String endpointId) {
        return resolver.resolve(appId, endpointId);
    }

    /**
     * External URL of a registered endpoint.
     *
     * @throws io.webendpoint.core.error.EndpointNotRegisteredException if the endpoint is not
     *                                                                  registered
     */
    public String computeUrl(String endpointId) {
        return EndpointUrls.url(registry.require(endpointId).config());
    }

    /**
     * Starts an endpoint.
     *
     * @param appId      owning application id
     * @param endpointId endpoint id
     * @return the registry entry, with one handle per bound listener (none if neither listener is
     *         enabled)
     * @throws io.webendpoint.core.error.ConfigResolveException             if the configuration
     *                                                                      is invalid
     * @throws io.webendpoint.core.error.EndpointAlreadyRegisteredException if the endpoint is
     *                                                                      already started
     * @throws PortInUseException                                           if a listener's port
     *                                                                      is taken
     * @throws ListenerStartFailedException                                 for any other adapter
     *                                                                      failure
     */
    public RegisteredEndpoint start(String appId, String endpointId) {
        EndpointConfig config = resolver.resolve(appId, endpointId);
        RegisteredEndpoint endpoint = registry.register(config);

        try {
            if (config.httpEnabled()) {
                bind(endpoint, ListenerSpecs.forScheme(config, Scheme.PLAIN));
            }
            if (config.httpsEnabled()) {
                bind(endpoint, ListenerSpecs.forScheme(config, Scheme.SECURE));
            }
        } catch (ListenerException e) {
            rollBack(endpoint);
            throw e;
        }

        if (!config.serves()) {
            LOG.info("Endpoint {} registered without listeners (http and https disabled)", endpointId);
        }
        return endpoint;
    }

    /**
     * Stops an endpoint. Listener shutdown is best-effort: failures are logged and never keep the
     * configuration registered. Stopping an endpoint that is not registered does nothing.
     *
     * @param endpointId endpoint id
     */
    public void stop(String endpointId) {
        Optional<RegisteredEndpoint> registered = registry.lookup(endpointId);
        if (registered.isEmpty()) {
            LOG.debug("Stop requested for {} but it is not registered", endpointId);
            return;
        }
        EndpointConfig config = registered.get().config();

        if (config.httpEnabled()) {
            shutdown(Scheme.PLAIN.listenerId(endpointId));
        }
        if (config.httpsEnabled()) {
            shutdown(Scheme.SECURE.listenerId(endpointId));
        }

        registry.deregister(endpointId);
        LOG.info("Stopped {}", endpointId);
    }

    /** The registry this manager writes to. */
    public EndpointRegistry registry() {
        return registry;
    }

    private void bind(RegisteredEndpoint endpoint, ListenerSpec spec) {
        ListenerHandle handle;
        try {
            handle = adapter.startListener(spec);
        } catch (AddressInUseException e) {
            throw new PortInUseException(spec.endpointId(), spec.scheme(), spec.port(), e);
        } catch (RuntimeException e) {
            throw new ListenerStartFailedException(spec.endpointId(), spec.scheme(), describe(e), e);
        }
        if (handle == null) {
            throw new ListenerStartFailedException(
                    spec.endpointId(), spec.scheme(), adapter.name() + " returned no listener handle", null);
        }

        endpoint.bound(handle);
        LOG.info(
                "Running {} with {} on port {} ({})",
                spec.endpointId(),
                adapter.name(),
                handle.port(),
                spec.scheme().urlScheme());
    }

    private void rollBack(RegisteredEndpoint endpoint) {
        for (ListenerHandle handle : endpoint.listeners().values()) {
            shutdown(handle.listenerId());
        }
        registry.deregister(endpoint.endpointId());
    }

    private void shutdown(String listenerId) {
        try {
            adapter.stopListener(listenerId);
        } catch (RuntimeException e) {
            LOG.warn("Failed to stop listener {}: {}", listenerId, e.getMessage(), e);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getName()
                : e.getClass().getSimpleName() + ": " + message;
    }
}
