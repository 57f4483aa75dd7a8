package io.webendpoint.core.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.webendpoint.core.config.EndpointConfig;
import io.webendpoint.core.config.EndpointDefaults;
import io.webendpoint.core.error.EndpointAlreadyRegisteredException;
import io.webendpoint.core.error.EndpointNotRegisteredException;
import org.junit.jupiter.api.Test;

/** Tests for {@link EndpointRegistry}. */
class EndpointRegistryTest {

    private static EndpointConfig config(String endpointId) {
        return EndpointDefaults.build("my_app", endpointId);
    }

    @Test
    void registerAndLookup() {
        var registry = new EndpointRegistry();
        EndpointConfig config = config("MyApp.Endpoint");

        RegisteredEndpoint entry = registry.register(config);

        assertThat(registry.lookup("MyApp.Endpoint")).hasValue(entry);
        assertThat(registry.require("MyApp.Endpoint").config()).isSameAs(config);
        assertThat(registry.isRegistered("MyApp.Endpoint")).isTrue();
        assertThat(entry.listeners()).isEmpty();
    }

    @Test
    void duplicateRegistrationFailsFastAndKeepsPriorEntry() {
        var registry = new EndpointRegistry();
        RegisteredEndpoint first = registry.register(config("MyApp.Endpoint"));

        assertThatThrownBy(() -> registry.register(config("MyApp.Endpoint")))
                .isInstanceOf(EndpointAlreadyRegisteredException.class)
                .hasMessageContaining("MyApp.Endpoint");

        assertThat(registry.require("MyApp.Endpoint")).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void lookupUnknownIsEmpty() {
        assertThat(new EndpointRegistry().lookup("Nope.Endpoint")).isEmpty();
    }

    @Test
    void requireUnknownThrows() {
        assertThatThrownBy(() -> new EndpointRegistry().require("Nope.Endpoint"))
                .isInstanceOf(EndpointNotRegisteredException.class)
                .hasMessageContaining("Nope.Endpoint");
    }

    @Test
    void deregisterRemovesEntry() {
        var registry = new EndpointRegistry();
        RegisteredEndpoint entry = registry.register(config("MyApp.Endpoint"));

        assertThat(registry.deregister("MyApp.Endpoint")).hasValue(entry);
        assertThat(registry.isRegistered("MyApp.Endpoint")).isFalse();
        assertThat(registry.deregister("MyApp.Endpoint")).isEmpty();
    }

    @Test
    void registerNullThrowsNpe() {
        assertThatThrownBy(() -> new EndpointRegistry().register(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void instancesAreIsolated() {
        var first = new EndpointRegistry();
        var second = new EndpointRegistry();
        first.register(config("MyApp.Endpoint"));

        assertThat(second.isRegistered("MyApp.Endpoint")).isFalse();
        second.register(config("MyApp.Endpoint"));
        assertThat(first.size()).isEqualTo(1);
        assertThat(second.size()).isEqualTo(1);
    }
}
