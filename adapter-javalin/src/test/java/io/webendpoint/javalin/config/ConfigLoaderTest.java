package io.webendpoint.javalin.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.webendpoint.core.config.EndpointOverrides;
import io.webendpoint.core.config.ListenerConfig;
import io.webendpoint.core.config.UrlConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML parsing. Loads classpath fixtures with an empty
 * environment so the host's variables cannot leak in.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("endpoint.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("ids and http port come from YAML, logging falls back to defaults")
        void loadMinimalConfig() throws Exception {
            StandaloneConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.appId()).isEqualTo("my_app");
            assertThat(config.endpointId()).isEqualTo("MyApp.Endpoint");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");

            EndpointOverrides endpoint = config.endpoint("MyApp.Endpoint").orElseThrow();
            assertThat(endpoint.http().port()).hasValue(4000);
            assertThat(endpoint.https()).isNull();
            assertThat(endpoint.url()).isNull();
            assertThat(endpoint.debugErrors()).isNull();
            assertThat(endpoint.secretKeyBase()).isNull();
        }

        @Test
        @DisplayName("unknown endpoint id → no overrides")
        void unknownEndpoint_isEmpty() throws Exception {
            StandaloneConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.endpoint("Other.Endpoint")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("every endpoint key is mapped")
        void loadFullConfig() throws Exception {
            StandaloneConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");

            EndpointOverrides endpoint = config.endpoint("MyApp.Endpoint").orElseThrow();
            assertThat(endpoint.debugErrors()).isTrue();
            assertThat(endpoint.renderErrors()).isEqualTo("MyApp.CustomErrorView");
            assertThat(endpoint.secretKeyBase()).isEqualTo("s3cr3t-key-base");
            assertThat(endpoint.url()).isEqualTo(new UrlConfig("https", "example.com", 443));
            assertThat(endpoint.longpollerWindowMs()).isEqualTo(20_000L);
            assertThat(endpoint.websocketSerializer()).isEqualTo("msgpack");

            assertThat(endpoint.http().port()).hasValue(4000);
            assertThat(endpoint.http().host()).isEqualTo("127.0.0.1");
            assertThat(endpoint.http().get("shutdown-timeout-ms")).isEqualTo(5000);
            assertThat(endpoint.https().port()).hasValue(4040);
            assertThat(endpoint.https().get("keystore")).isEqualTo("/etc/endpoint/server.p12");
            assertThat(endpoint.https().get("keystore-password")).isEqualTo("changeit");
        }

        @Test
        @DisplayName("false disables a listener section, true enables it without options")
        void booleanListenerSections() throws Exception {
            StandaloneConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            EndpointOverrides admin = config.endpoint("MyApp.Admin").orElseThrow();
            assertThat(admin.http().enabled()).isFalse();
            assertThat(admin.https()).isEqualTo(ListenerConfig.empty());
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("empty file → defaults, no endpoints, no ids")
        void emptyFile() throws Exception {
            StandaloneConfig config = ConfigLoader.load(write(""), NO_ENV);

            assertThat(config.appId()).isNull();
            assertThat(config.endpointId()).isNull();
            assertThat(config.endpoints()).isEmpty();
            assertThat(config.loggingFormat()).isEqualTo("text");
        }

        @Test
        @DisplayName("null listener section → disabled")
        void nullListenerSection_isDisabled() throws Exception {
            StandaloneConfig config = ConfigLoader.load(write("""
                    endpoints:
                      E:
                        https: ~
                    """), NO_ENV);

            assertThat(config.endpoint("E").orElseThrow().https().enabled()).isFalse();
        }

        @Test
        @DisplayName("blank scalar values leave the key unset")
        void blankScalarsAreUnset() throws Exception {
            StandaloneConfig config = ConfigLoader.load(write("""
                    endpoints:
                      E:
                        debug-errors:
                        render-errors:
                        secret-key-base:
                        url:
                          host: example.com
                          port:
                        transports:
                          longpoller-window-ms:
                          websocket-serializer:
                    """), NO_ENV);

            EndpointOverrides endpoint = config.endpoint("E").orElseThrow();
            assertThat(endpoint.debugErrors()).isNull();
            assertThat(endpoint.renderErrors()).isNull();
            assertThat(endpoint.secretKeyBase()).isNull();
            assertThat(endpoint.url()).isEqualTo(new UrlConfig(null, "example.com", null));
            assertThat(endpoint.longpollerWindowMs()).isNull();
            assertThat(endpoint.websocketSerializer()).isNull();
        }

        @Test
        @DisplayName("quoted booleans and numbers are accepted")
        void quotedScalarsAccepted() throws Exception {
            StandaloneConfig config = ConfigLoader.load(write("""
                    endpoints:
                      E:
                        debug-errors: "true"
                        transports:
                          longpoller-window-ms: "15000"
                    """), NO_ENV);

            EndpointOverrides endpoint = config.endpoint("E").orElseThrow();
            assertThat(endpoint.debugErrors()).isTrue();
            assertThat(endpoint.longpollerWindowMs()).isEqualTo(15_000L);
        }

        @Test
        @DisplayName("logging values are normalised")
        void loggingValuesNormalised() throws Exception {
            StandaloneConfig config = ConfigLoader.load(write("""
                    logging:
                      format: JSON
                      level: warn
                    """), NO_ENV);

            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }
    }

    @Nested
    @DisplayName("Error paths")
    class ErrorPaths {

        @Test
        @DisplayName("missing file → descriptive ConfigLoadException")
        void missingFile() {
            assertThatThrownBy(() -> ConfigLoader.load(Path.of("/nonexistent/endpoint.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        @DisplayName("malformed YAML → ConfigLoadException")
        void malformedYaml() throws Exception {
            Path file = write("this is: not: valid: yaml: {{{}}}");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV)).isInstanceOf(ConfigLoadException.class);
        }

        @Test
        @DisplayName("invalid logging level names the key")
        void invalidLoggingLevel() throws Exception {
            Path file = write("""
                    logging:
                      level: VERBOSE
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("logging.level");
        }

        @Test
        @DisplayName("invalid logging format names the key")
        void invalidLoggingFormat() throws Exception {
            Path file = write("""
                    logging:
                      format: xml
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("logging.format");
        }

        @Test
        @DisplayName("non-numeric url.port names the key")
        void invalidUrlPort() throws Exception {
            Path file = write("""
                    endpoints:
                      E:
                        url:
                          port: eighty
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("endpoints.E.url.port");
        }

        @Test
        @DisplayName("non-boolean debug-errors names the key")
        void invalidDebugErrors() throws Exception {
            Path file = write("""
                    endpoints:
                      E:
                        debug-errors: "yes"
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("endpoints.E.debug-errors");
        }

        @Test
        @DisplayName("non-numeric longpoller window names the key")
        void invalidLongpollerWindow() throws Exception {
            Path file = write("""
                    endpoints:
                      E:
                        transports:
                          longpoller-window-ms: abc
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("endpoints.E.transports.longpoller-window-ms");
        }

        @Test
        @DisplayName("scalar listener section is rejected")
        void scalarListenerSection() throws Exception {
            Path file = write("""
                    endpoints:
                      E:
                        http: 4000
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("endpoints.E.http");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class ConfigPathResolution {

        @Test
        void defaultsToEndpointYaml() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("endpoint.yaml"));
        }

        @Test
        void configFlagWins() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/endpoint/app.yaml"}))
                    .isEqualTo(Path.of("/etc/endpoint/app.yaml"));
        }

        @Test
        void configFlagWithoutValue_isRejected() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }
    }
}
