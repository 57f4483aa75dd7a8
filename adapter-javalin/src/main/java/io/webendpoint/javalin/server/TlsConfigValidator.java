package io.webendpoint.javalin.server;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the TLS options of a secure listener before Jetty sees them.
 *
 * <p>
 * Checks that keystore/truststore files exist, are readable, and open with the configured
 * password, so that a misconfigured listener fails with a message naming the option instead of
 * a handshake error at the first request.
 */
public final class TlsConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigValidator.class);

    private static final Set<String> CLIENT_AUTH_MODES = Set.of("none", "want", "need");

    private TlsConfigValidator() {}

    /**
     * Validates the settings of one secure listener.
     *
     * @param listenerId the listener, used in messages
     * @param tls        the TLS settings
     * @throws IllegalStateException if any setting is invalid
     */
    public static void validate(String listenerId, TlsSettings tls) {
        if (tls.keystore() == null || tls.keystore().isBlank()) {
            throw new IllegalStateException("Secure listener " + listenerId + " has no keystore. "
                    + "Set https.keystore to a valid PKCS12 or JKS keystore file.");
        }
        if (!CLIENT_AUTH_MODES.contains(tls.clientAuth())) {
            throw new IllegalStateException("https.client-auth must be one of " + CLIENT_AUTH_MODES + ", got '"
                    + tls.clientAuth() + "'");
        }

        verifyKeystore("https keystore", tls.keystore(), tls.keystorePassword(), tls.keystoreType());

        if (tls.clientAuthEnabled()) {
            if (tls.truststore() == null || tls.truststore().isBlank()) {
                throw new IllegalStateException("https.client-auth=" + tls.clientAuth()
                        + " requires a truststore for client certificate validation. "
                        + "Set https.truststore to a valid truststore file.");
            }
            verifyKeystore("https truststore", tls.truststore(), tls.truststorePassword(), tls.truststoreType());
        }

        LOG.debug("TLS settings of {} validated", listenerId);
    }

    private static void verifyKeystore(String label, String path, String password, String type) {
        Path storePath = Path.of(path);

        if (!Files.exists(storePath)) {
            throw new IllegalStateException(label + " file does not exist: " + path);
        }
        if (!Files.isReadable(storePath)) {
            throw new IllegalStateException(label + " file is not readable: " + path);
        }

        try {
            KeyStore ks = KeyStore.getInstance(type);
            try (InputStream is = Files.newInputStream(storePath)) {
                ks.load(is, password != null ? password.toCharArray() : null);
            }
        } catch (Exception e) {
            throw new IllegalStateException(
                    label + " could not be loaded (wrong password or corrupt file?): " + path + ": " + e.getMessage(),
                    e);
        }
    }
}
