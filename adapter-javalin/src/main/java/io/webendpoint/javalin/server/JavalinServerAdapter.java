package io.webendpoint.javalin.server;

import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import io.webendpoint.core.spi.AddressInUseException;
import io.webendpoint.core.spi.ListenerHandle;
import io.webendpoint.core.spi.ListenerSpec;
import io.webendpoint.core.spi.Scheme;
import io.webendpoint.core.spi.ServerAdapter;
import java.net.BindException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ServerAdapter} backed by Javalin on embedded Jetty.
 *
 * <p>
 * Each listener is its own Javalin instance: plain listeners use Javalin's default HTTP
 * connector, secure listeners get a single TLS connector (see {@link TlsConfigurator}). Every
 * request on every path is handed to the dispatch handler resolved for the listener's dispatch
 * target.
 *
 * <p>
 * Recognised listener options besides {@code host} and {@code port}: the TLS keys of
 * {@link TlsSettings} and {@code shutdown-timeout-ms}, the time Jetty waits for in-flight
 * requests on stop.
 */
public final class JavalinServerAdapter implements ServerAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinServerAdapter.class);

    static final String SHUTDOWN_TIMEOUT_OPTION = "shutdown-timeout-ms";
    static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 30_000;

    private static final List<HandlerType> DISPATCHED_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private final Map<String, Javalin> listeners = new ConcurrentHashMap<>();
    private final Function<String, Handler> dispatchResolver;

    /** Adapter answering every request with {@link EndpointStatusHandler}. */
    public JavalinServerAdapter() {
        this(EndpointStatusHandler::new);
    }

    /**
     * @param dispatchResolver maps a listener's dispatch target (the endpoint id) to the handler
     *                         serving its requests
     */
    public JavalinServerAdapter(Function<String, Handler> dispatchResolver) {
        this.dispatchResolver = Objects.requireNonNull(dispatchResolver, "dispatchResolver must not be null");
    }

    @Override
    public String name() {
        return "Javalin";
    }

    @Override
    public ListenerHandle startListener(ListenerSpec spec) {
        if (listeners.containsKey(spec.listenerId())) {
            throw new IllegalStateException("Listener already running: " + spec.listenerId());
        }

        TlsSettings tls = null;
        if (spec.scheme() == Scheme.SECURE) {
            tls = TlsSettings.from(spec);
            TlsConfigValidator.validate(spec.listenerId(), tls);
        }
        long shutdownTimeoutMs = shutdownTimeout(spec);
        Handler handler = Objects.requireNonNull(
                dispatchResolver.apply(spec.dispatchTarget()), "no dispatch handler for " + spec.dispatchTarget());

        TlsSettings secure = tls;
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jetty.modifyServer(server -> server.setStopTimeout(shutdownTimeoutMs));
            if (secure != null) {
                TlsConfigurator.configureSecureConnector(javalinConfig, secure, spec.host(), spec.port());
            } else {
                javalinConfig.jetty.defaultHost = spec.host();
                javalinConfig.jetty.defaultPort = spec.port();
            }
        });
        for (HandlerType method : DISPATCHED_METHODS) {
            app.addHttpHandler(method, "/", handler);
            app.addHttpHandler(method, "/<path>", handler);
        }

        try {
            app.start();
        } catch (RuntimeException e) {
            stopQuietly(spec.listenerId(), app);
            if (isBindFailure(e)) {
                throw new AddressInUseException(
                        spec.port(), "Port " + spec.port() + " is already in use (" + spec.listenerId() + ")", e);
            }
            throw e;
        }

        listeners.put(spec.listenerId(), app);
        LOG.debug("Listener {} bound to {}:{}", spec.listenerId(), spec.host() == null ? "*" : spec.host(), app.port());
        return new ListenerHandle(spec.listenerId(), spec.scheme(), app.port());
    }

    @Override
    public void stopListener(String listenerId) {
        Javalin app = listeners.remove(listenerId);
        if (app == null) {
            LOG.debug("Listener {} is not running, nothing to stop", listenerId);
            return;
        }
        app.stop();
        LOG.debug("Listener {} stopped", listenerId);
    }

    /** Returns {@code true} if the listener is currently running. */
    public boolean isRunning(String listenerId) {
        return listeners.containsKey(listenerId);
    }

    private static long shutdownTimeout(ListenerSpec spec) {
        String value = spec.option(SHUTDOWN_TIMEOUT_OPTION);
        if (value == null) {
            return DEFAULT_SHUTDOWN_TIMEOUT_MS;
        }
        try {
            long timeout = Long.parseLong(value.trim());
            if (timeout < 0) {
                throw new IllegalArgumentException(SHUTDOWN_TIMEOUT_OPTION + " must not be negative: " + value);
            }
            return timeout;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(SHUTDOWN_TIMEOUT_OPTION + " is not a number: '" + value + "'", e);
        }
    }

    static boolean isBindFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof BindException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static void stopQuietly(String listenerId, Javalin app) {
        try {
            app.stop();
        } catch (RuntimeException e) {
            LOG.debug("Cleanup of listener {} after failed start raised: {}", listenerId, e.getMessage(), e);
        }
    }
}
