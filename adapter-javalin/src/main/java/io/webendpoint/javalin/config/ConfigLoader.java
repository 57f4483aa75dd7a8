package io.webendpoint.javalin.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.webendpoint.core.config.EndpointOverrides;
import io.webendpoint.core.config.ListenerConfig;
import io.webendpoint.core.config.UrlConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code endpoint.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * File layout:
 *
 * <pre>
 * app: my_app
 * endpoint: MyApp.Endpoint
 * logging:
 *   format: text          # or json
 *   level: INFO
 * endpoints:
 *   MyApp.Endpoint:
 *     debug-errors: false
 *     render-errors: MyApp.ErrorView
 *     secret-key-base: "..."
 *     url: { scheme: https, host: example.com, port: 443 }
 *     transports: { longpoller-window-ms: 10000, websocket-serializer: json }
 *     http: { port: 4000 }   # or false
 *     https: false           # or a mapping of listener options
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values and apply to the started endpoint.
 * An env var is considered "set" if and only if it is defined AND its trimmed value is
 * non-empty; empty or whitespace-only values are treated as "unset" and the YAML value is used.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> OPTIONS_TYPE = new TypeReference<>() {};

    static final String DEFAULT_CONFIG_FILE = "endpoint.yaml";
    static final String DEFAULT_LOGGING_FORMAT = "text";
    static final String DEFAULT_LOGGING_LEVEL = "INFO";

    private static final Set<String> LOGGING_FORMATS = Set.of("json", "text");
    private static final Set<String> LOGGING_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying environment variable overrides from the supplied lookup
     * function. Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static StandaloneConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static StandaloneConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        String appId = envStringOrDefault(envLookup, "APP_ID", textOrNull(root, "app"));
        String endpointId = envStringOrDefault(envLookup, "ENDPOINT_ID", textOrNull(root, "endpoint"));

        JsonNode logging = root.path("logging");
        String loggingFormat = envStringOrDefault(
                        envLookup, "LOG_FORMAT", textOrDefault(logging, "format", DEFAULT_LOGGING_FORMAT))
                .toLowerCase(Locale.ROOT);
        String loggingLevel = envStringOrDefault(
                        envLookup, "LOG_LEVEL", textOrDefault(logging, "level", DEFAULT_LOGGING_LEVEL))
                .toUpperCase(Locale.ROOT);
        if (!LOGGING_FORMATS.contains(loggingFormat)) {
            throw new ConfigLoadException(
                    "logging.format must be one of " + LOGGING_FORMATS + ", got '" + loggingFormat + "'");
        }
        if (!LOGGING_LEVELS.contains(loggingLevel)) {
            throw new ConfigLoadException(
                    "logging.level must be one of " + LOGGING_LEVELS + ", got '" + loggingLevel + "'");
        }

        Map<String, EndpointOverrides> endpoints = new LinkedHashMap<>();
        JsonNode endpointsNode = root.path("endpoints");
        if (!endpointsNode.isMissingNode() && !endpointsNode.isNull() && !endpointsNode.isObject()) {
            throw new ConfigLoadException("endpoints must be a mapping of endpoint id to settings");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = endpointsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            endpoints.put(field.getKey(), mapEndpoint(field.getKey(), field.getValue()));
        }

        // --- Environment variable overlay for the started endpoint ---
        if (endpointId != null) {
            EndpointOverrides base = endpoints.getOrDefault(endpointId, EndpointOverrides.none());
            endpoints.put(endpointId, applyEnvOverrides(base, envLookup));
        }

        return new StandaloneConfig(appId, endpointId, loggingFormat, loggingLevel, endpoints);
    }

    private static EndpointOverrides mapEndpoint(String endpointId, JsonNode node) {
        String prefix = "endpoints." + endpointId + ".";
        if (node == null || node.isNull()) {
            return EndpointOverrides.none();
        }
        if (!node.isObject()) {
            throw new ConfigLoadException(prefix.substring(0, prefix.length() - 1) + " must be a mapping");
        }

        EndpointOverrides.Builder builder = EndpointOverrides.builder();
        builder.debugErrors(booleanOrNull(node, "debug-errors", prefix));
        builder.renderErrors(textOrNull(node, "render-errors"));
        builder.secretKeyBase(textOrNull(node, "secret-key-base"));

        JsonNode transports = node.path("transports");
        builder.longpollerWindowMs(longOrNull(transports, "longpoller-window-ms", prefix + "transports."));
        builder.websocketSerializer(textOrNull(transports, "websocket-serializer"));

        JsonNode url = node.path("url");
        if (url.isObject()) {
            builder.url(urlConfig(
                    textOrNull(url, "scheme"), textOrNull(url, "host"), textOrNull(url, "port"), prefix + "url.port"));
        }

        builder.http(listenerSection(node, "http", prefix));
        builder.https(listenerSection(node, "https", prefix));
        return builder.build();
    }

    /**
     * Maps a listener section: absent → unset, {@code false}/null → disabled, {@code true} →
     * enabled without options, mapping → enabled with those options.
     */
    private static ListenerConfig listenerSection(JsonNode endpoint, String field, String prefix) {
        if (!endpoint.has(field)) {
            return null;
        }
        JsonNode section = endpoint.get(field);
        if (section.isNull()) {
            return ListenerConfig.disabled();
        }
        if (section.isBoolean()) {
            return section.asBoolean() ? ListenerConfig.empty() : ListenerConfig.disabled();
        }
        if (section.isObject()) {
            return ListenerConfig.of(YAML_MAPPER.convertValue(section, OPTIONS_TYPE));
        }
        throw new ConfigLoadException(prefix + field + " must be false, true or a mapping of listener options");
    }

    private static UrlConfig urlConfig(String scheme, String host, String port, String key) {
        try {
            return UrlConfig.of(scheme, host, port);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Applies environment variable overrides to the started endpoint. A port variable enables
     * the listener section if the YAML left it unset or disabled.
     */
    private static EndpointOverrides applyEnvOverrides(EndpointOverrides base, Function<String, String> envLookup) {
        EndpointOverrides.Builder builder = base.toBuilder();

        envString(envLookup, "ENDPOINT_SECRET_KEY_BASE", builder::secretKeyBase);
        envBool(envLookup, "ENDPOINT_DEBUG_ERRORS", builder::debugErrors);

        if (isSet(envLookup, "ENDPOINT_HTTP_PORT")) {
            builder.http(withPort(base.http(), envLookup.apply("ENDPOINT_HTTP_PORT").trim()));
        }
        if (isSet(envLookup, "ENDPOINT_HTTPS_PORT")) {
            builder.https(withPort(base.https(), envLookup.apply("ENDPOINT_HTTPS_PORT").trim()));
        }

        if (isSet(envLookup, "ENDPOINT_URL_SCHEME")
                || isSet(envLookup, "ENDPOINT_URL_HOST")
                || isSet(envLookup, "ENDPOINT_URL_PORT")) {
            UrlConfig yamlUrl = base.url() != null ? base.url() : new UrlConfig(null, null, null);
            UrlConfig envUrl = urlConfig(
                    envStringOrDefault(envLookup, "ENDPOINT_URL_SCHEME", null),
                    envStringOrDefault(envLookup, "ENDPOINT_URL_HOST", null),
                    envStringOrDefault(envLookup, "ENDPOINT_URL_PORT", null),
                    "ENDPOINT_URL_PORT");
            builder.url(yamlUrl.overlay(envUrl));
        }

        return builder.build();
    }

    private static ListenerConfig withPort(ListenerConfig section, String port) {
        ListenerConfig enabled = section != null && section.enabled() ? section : ListenerConfig.empty();
        return enabled.withOption(ListenerConfig.PORT, port);
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    /** Accepts YAML booleans and the strings {@code true}/{@code false}; null means unset. */
    private static Boolean booleanOrNull(JsonNode node, String field, String prefix) {
        if (!node.hasNonNull(field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText().trim();
        if (value.isTextual() && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigLoadException(prefix + field + " must be true or false, got '" + value.asText() + "'");
    }

    /** Accepts integral numbers and numeric strings; null means unset. */
    private static Long longOrNull(JsonNode node, String field, String prefix) {
        if (!node.hasNonNull(field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(
                        prefix + field + " must be an integer, got '" + value.asText() + "'", e);
            }
        }
        throw new ConfigLoadException(prefix + field + " must be an integer, got '" + value.asText() + "'");
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }
}
