package io.webendpoint.javalin.server;

import io.webendpoint.core.config.ConfigResolver;
import io.webendpoint.core.lifecycle.EndpointLifecycleManager;
import io.webendpoint.core.lifecycle.EndpointRegistry;
import io.webendpoint.core.lifecycle.RegisteredEndpoint;
import io.webendpoint.javalin.config.ConfigLoadException;
import io.webendpoint.javalin.config.ConfigLoader;
import io.webendpoint.javalin.config.StandaloneConfig;
import io.webendpoint.javalin.config.YamlConfigSource;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one endpoint as a standalone process.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>Load the YAML configuration with its environment overlay</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Wire the lifecycle manager to a {@link YamlConfigSource} over the same file and a
 * {@link JavalinServerAdapter}</li>
 * <li>Start the endpoint and log its external URL</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.webendpoint.javalin.StandaloneMain} so tests can start and stop the
 * process without going through {@code main()}.
 */
public final class EndpointApp {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointApp.class);

    private final EndpointLifecycleManager manager;
    private final JavalinServerAdapter adapter;
    private final RegisteredEndpoint endpoint;

    private EndpointApp(EndpointLifecycleManager manager, JavalinServerAdapter adapter, RegisteredEndpoint endpoint) {
        this.manager = manager;
        this.adapter = adapter;
        this.endpoint = endpoint;
    }

    /**
     * Executes the startup sequence with environment overrides from {@link System#getenv}.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/endpoint.yaml})
     * @return the running application
     */
    public static EndpointApp start(String[] args) {
        return start(args, System::getenv);
    }

    /**
     * Executes the startup sequence with environment overrides from {@code envLookup}.
     *
     * @throws ConfigLoadException if the configuration file is missing or invalid
     * @throws io.webendpoint.core.error.EndpointException if the endpoint fails to resolve or
     *                                                     bind
     */
    public static EndpointApp start(String[] args, Function<String, String> envLookup) {
        long startTime = System.nanoTime();

        Path configPath = ConfigLoader.resolveConfigPath(args);
        StandaloneConfig config = ConfigLoader.load(configPath, envLookup);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);

        if (config.appId() == null || config.appId().isBlank()) {
            throw new ConfigLoadException("app must be set (YAML 'app' or env APP_ID)");
        }
        if (config.endpointId() == null || config.endpointId().isBlank()) {
            throw new ConfigLoadException("endpoint must be set (YAML 'endpoint' or env ENDPOINT_ID)");
        }

        JavalinServerAdapter adapter = new JavalinServerAdapter();
        EndpointLifecycleManager manager = new EndpointLifecycleManager(
                new ConfigResolver(new YamlConfigSource(configPath, envLookup)), new EndpointRegistry(), adapter);
        RegisteredEndpoint endpoint = manager.start(config.appId(), config.endpointId());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "Endpoint {} of {} started: url={}, listeners={}, startupMs={}",
                endpoint.endpointId(),
                config.appId(),
                endpoint.url(),
                endpoint.listeners().keySet(),
                elapsedMs);
        return new EndpointApp(manager, adapter, endpoint);
    }

    /** Returns the started endpoint's registry entry. */
    public RegisteredEndpoint endpoint() {
        return endpoint;
    }

    /** Returns the lifecycle manager that started the endpoint. */
    public EndpointLifecycleManager manager() {
        return manager;
    }

    /** Returns the server adapter holding the listeners. */
    public JavalinServerAdapter adapter() {
        return adapter;
    }

    /** Returns the bound port per URL scheme ({@code http}, {@code https}). */
    public Map<String, Integer> ports() {
        Map<String, Integer> ports = new LinkedHashMap<>();
        endpoint.listeners().forEach((scheme, handle) -> ports.put(scheme.urlScheme(), handle.port()));
        return ports;
    }

    /** Stops the endpoint's listeners and deregisters it. Safe to call more than once. */
    public void stop() {
        manager.stop(endpoint.endpointId());
    }
}
