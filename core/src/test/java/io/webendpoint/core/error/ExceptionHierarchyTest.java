package io.webendpoint.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.webendpoint.core.spi.Scheme;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: structure, common fields and messages. */
class ExceptionHierarchyTest {

    @Test
    void endpointExceptionIsAbstractAndRoot() {
        assertThat(EndpointException.class).isAbstract();
        assertThat(EndpointException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void listenerExceptionIsAbstract() {
        assertThat(ListenerException.class).isAbstract();
        assertThat(ListenerException.class.getSuperclass()).isEqualTo(EndpointException.class);
    }

    @Test
    void portInUseCarriesPortAndScheme() {
        var cause = new RuntimeException("bind");
        var ex = new PortInUseException("MyApp.Endpoint", Scheme.SECURE, 4040, cause);

        assertThat(ex).isInstanceOf(ListenerException.class);
        assertThat(ex.port()).isEqualTo(4040);
        assertThat(ex.scheme()).isEqualTo(Scheme.SECURE);
        assertThat(ex.endpointId()).isEqualTo("MyApp.Endpoint");
        assertThat(ex.detail()).isEqualTo("Port 4040 is already in use");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void listenerStartFailedCarriesReason() {
        var ex = new ListenerStartFailedException("MyApp.Endpoint", Scheme.PLAIN, "boom", null);

        assertThat(ex).isInstanceOf(ListenerException.class);
        assertThat(ex.reason()).isEqualTo("boom");
        assertThat(ex.getMessage()).contains("MyApp.Endpoint").contains("(http)").endsWith("boom");
    }

    @Test
    void configResolveCarriesKey() {
        var ex = new ConfigResolveException("bad port", "MyApp.Endpoint", "http.port");

        assertThat(ex).isInstanceOf(EndpointException.class);
        assertThat(ex.key()).isEqualTo("http.port");
        assertThat(ex.endpointId()).isEqualTo("MyApp.Endpoint");
    }

    @Test
    void registrationExceptionsNameTheEndpoint() {
        assertThat(new EndpointAlreadyRegisteredException("A.Endpoint"))
                .isInstanceOf(EndpointException.class)
                .hasMessageContaining("A.Endpoint");
        assertThat(new EndpointNotRegisteredException("B.Endpoint"))
                .isInstanceOf(EndpointException.class)
                .hasMessageContaining("B.Endpoint");
    }
}
