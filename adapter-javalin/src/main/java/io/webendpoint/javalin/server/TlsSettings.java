package io.webendpoint.javalin.server;

import io.webendpoint.core.spi.ListenerSpec;

/**
 * TLS options of a secure listener, read from the merged {@code https} listener options.
 *
 * @param keystore           path to the server certificate keystore ({@code keystore})
 * @param keystorePassword   keystore password ({@code keystore-password})
 * @param keystoreType       PKCS12 or JKS ({@code keystore-type}, default PKCS12)
 * @param clientAuth         none, want or need ({@code client-auth}, default none)
 * @param truststore         client CA truststore for mTLS ({@code truststore})
 * @param truststorePassword truststore password ({@code truststore-password})
 * @param truststoreType     PKCS12 or JKS ({@code truststore-type}, default PKCS12)
 */
public record TlsSettings(
        String keystore,
        String keystorePassword,
        String keystoreType,
        String clientAuth,
        String truststore,
        String truststorePassword,
        String truststoreType) {

    static final String DEFAULT_STORE_TYPE = "PKCS12";
    static final String DEFAULT_CLIENT_AUTH = "none";

    /** Reads the TLS options of a listener, applying defaults for types and client auth. */
    public static TlsSettings from(ListenerSpec spec) {
        return new TlsSettings(
                spec.option("keystore"),
                spec.option("keystore-password"),
                orDefault(spec.option("keystore-type"), DEFAULT_STORE_TYPE),
                orDefault(spec.option("client-auth"), DEFAULT_CLIENT_AUTH),
                spec.option("truststore"),
                spec.option("truststore-password"),
                orDefault(spec.option("truststore-type"), DEFAULT_STORE_TYPE));
    }

    /** True when client certificates are requested or required. */
    public boolean clientAuthEnabled() {
        return "need".equals(clientAuth) || "want".equals(clientAuth);
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }

    @Override
    public String toString() {
        return "TlsSettings[keystore=" + keystore + ", keystoreType=" + keystoreType + ", clientAuth=" + clientAuth
                + ", truststore=" + truststore + ", truststoreType=" + truststoreType + "]";
    }
}
