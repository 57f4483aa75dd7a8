package io.webendpoint.javalin.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.webendpoint.core.spi.ListenerSpec;
import io.webendpoint.core.spi.Scheme;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link TlsSettings} option parsing and {@link TlsConfigValidator}. */
@DisplayName("TLS settings validation")
class TlsConfigValidatorTest {

    private static final String LISTENER = "MyApp.Endpoint.HTTPS";

    @TempDir
    Path tempDir;

    private static String keystorePath() throws Exception {
        return Path.of(TlsConfigValidatorTest.class
                        .getClassLoader()
                        .getResource("tls/server.p12")
                        .toURI())
                .toString();
    }

    private static TlsSettings settings(Map<String, Object> options) {
        return TlsSettings.from(new ListenerSpec("MyApp.Endpoint", LISTENER, Scheme.SECURE, null, 0, "MyApp.Endpoint", options));
    }

    private static Map<String, Object> validOptions() throws Exception {
        Map<String, Object> options = new HashMap<>();
        options.put("keystore", keystorePath());
        options.put("keystore-password", "changeit");
        return options;
    }

    @Test
    @DisplayName("defaults: PKCS12 stores, no client auth")
    void defaults() throws Exception {
        TlsSettings tls = settings(validOptions());

        assertThat(tls.keystoreType()).isEqualTo("PKCS12");
        assertThat(tls.truststoreType()).isEqualTo("PKCS12");
        assertThat(tls.clientAuth()).isEqualTo("none");
        assertThat(tls.clientAuthEnabled()).isFalse();
        assertThat(tls.toString()).doesNotContain("changeit");
    }

    @Test
    @DisplayName("valid keystore passes")
    void validKeystore() throws Exception {
        assertThatCode(() -> TlsConfigValidator.validate(LISTENER, settings(validOptions())))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("missing keystore option is rejected")
    void missingKeystoreOption() {
        assertThatThrownBy(() -> TlsConfigValidator.validate(LISTENER, settings(Map.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(LISTENER)
                .hasMessageContaining("https.keystore");
    }

    @Test
    @DisplayName("keystore file that does not exist is rejected")
    void keystoreFileMissing() {
        var tls = settings(Map.of("keystore", tempDir.resolve("absent.p12").toString()));

        assertThatThrownBy(() -> TlsConfigValidator.validate(LISTENER, tls))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    @DisplayName("wrong keystore password is rejected")
    void wrongPassword() throws Exception {
        Map<String, Object> options = validOptions();
        options.put("keystore-password", "wrong");

        assertThatThrownBy(() -> TlsConfigValidator.validate(LISTENER, settings(options)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("could not be loaded");
    }

    @Test
    @DisplayName("corrupt keystore is rejected")
    void corruptKeystore() throws Exception {
        Path corrupt = tempDir.resolve("corrupt.p12");
        Files.writeString(corrupt, "not a keystore");

        var tls = settings(Map.of("keystore", corrupt.toString(), "keystore-password", "changeit"));

        assertThatThrownBy(() -> TlsConfigValidator.validate(LISTENER, tls))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("could not be loaded");
    }

    @Test
    @DisplayName("unknown client-auth mode is rejected")
    void unknownClientAuth() throws Exception {
        Map<String, Object> options = validOptions();
        options.put("client-auth", "sometimes");

        assertThatThrownBy(() -> TlsConfigValidator.validate(LISTENER, settings(options)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("client-auth");
    }

    @Test
    @DisplayName("client-auth=need without truststore is rejected")
    void needWithoutTruststore() throws Exception {
        Map<String, Object> options = validOptions();
        options.put("client-auth", "need");

        assertThatThrownBy(() -> TlsConfigValidator.validate(LISTENER, settings(options)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("truststore");
    }

    @Test
    @DisplayName("client-auth=want with a loadable truststore passes")
    void wantWithTruststore() throws Exception {
        Map<String, Object> options = validOptions();
        options.put("client-auth", "want");
        options.put("truststore", keystorePath());
        options.put("truststore-password", "changeit");

        assertThatCode(() -> TlsConfigValidator.validate(LISTENER, settings(options)))
                .doesNotThrowAnyException();
    }
}
