package io.webendpoint.javalin;

import io.webendpoint.javalin.server.EndpointApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running a single endpoint as a standalone process.
 *
 * <p>
 * Delegates to {@link EndpointApp#start(String[])}. On failure, logs the error and exits with
 * status 1; once started, a shutdown hook stops the endpoint's listeners.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/endpoint.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            EndpointApp app = EndpointApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "endpoint-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
