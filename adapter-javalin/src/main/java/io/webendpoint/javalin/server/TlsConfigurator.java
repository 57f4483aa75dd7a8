package io.webendpoint.javalin.server;

import io.javalin.config.JavalinConfig;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.util.ssl.SslContextFactory;

/**
 * Gives a Javalin instance a single TLS connector, using Jetty's {@link SslContextFactory.Server}
 * with the keystore, truststore and client-auth settings of the listener.
 */
final class TlsConfigurator {

    private TlsConfigurator() {}

    /**
     * Adds the HTTPS connector. Because a connector is registered, Javalin does not add its
     * default plain connector, so the instance only speaks TLS.
     *
     * @param javalinConfig the Javalin configuration to modify
     * @param tls           validated TLS settings
     * @param host          bind host, or {@code null} for all interfaces
     * @param port          bind port, {@code 0} for an ephemeral port
     */
    static void configureSecureConnector(JavalinConfig javalinConfig, TlsSettings tls, String host, int port) {
        javalinConfig.jetty.addConnector((server, httpConfig) -> {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
            sslContextFactory.setKeyStorePath(tls.keystore());
            sslContextFactory.setKeyStorePassword(tls.keystorePassword());
            sslContextFactory.setKeyStoreType(tls.keystoreType());

            switch (tls.clientAuth()) {
                case "need" -> {
                    sslContextFactory.setNeedClientAuth(true);
                    configureTruststore(sslContextFactory, tls);
                }
                case "want" -> {
                    sslContextFactory.setWantClientAuth(true);
                    configureTruststore(sslContextFactory, tls);
                }
                default -> {
                    // "none"
                }
            }

            HttpConfiguration httpsConfig = new HttpConfiguration(httpConfig);
            httpsConfig.setSecureScheme("https");
            httpsConfig.addCustomizer(new SecureRequestCustomizer());

            ServerConnector sslConnector = new ServerConnector(
                    server,
                    new SslConnectionFactory(sslContextFactory, "http/1.1"),
                    new HttpConnectionFactory(httpsConfig));
            sslConnector.setHost(host);
            sslConnector.setPort(port);
            return sslConnector;
        });
    }

    private static void configureTruststore(SslContextFactory.Server sslContextFactory, TlsSettings tls) {
        if (tls.truststore() != null) {
            sslContextFactory.setTrustStorePath(tls.truststore());
            sslContextFactory.setTrustStorePassword(tls.truststorePassword());
            sslContextFactory.setTrustStoreType(tls.truststoreType());
        }
    }
}
