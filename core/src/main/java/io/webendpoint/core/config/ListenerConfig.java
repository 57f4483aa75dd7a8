package io.webendpoint.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Options of one listener section ({@code http} or {@code https}).
 *
 * <p>
 * Besides the well-known {@link #PORT} and {@link #HOST} keys, a section carries arbitrary
 * options that are passed through to the server adapter untouched (TLS keystores, timeouts and
 * the like). Insertion order is preserved; {@code null} values are dropped.
 *
 * <p>
 * A section can also be explicitly {@linkplain #disabled() disabled}, which is how an override
 * switches off a listener enabled elsewhere.
 */
public final class ListenerConfig {

    public static final String PORT = "port";
    public static final String HOST = "host";

    private static final ListenerConfig DISABLED = new ListenerConfig(Map.of(), false);

    private final Map<String, Object> options;
    private final boolean enabled;

    private ListenerConfig(Map<String, Object> options, boolean enabled) {
        this.options = options;
        this.enabled = enabled;
    }

    /** An enabled section with the given options. */
    public static ListenerConfig of(Map<String, ?> options) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (options != null) {
            options.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        return new ListenerConfig(Collections.unmodifiableMap(copy), true);
    }

    /** An enabled section without options. */
    public static ListenerConfig empty() {
        return of(Map.of());
    }

    /** Marker for a section that is switched off. */
    public static ListenerConfig disabled() {
        return DISABLED;
    }

    public boolean enabled() {
        return enabled;
    }

    /** Unmodifiable view of all options, in insertion order. */
    public Map<String, Object> options() {
        return options;
    }

    public Object get(String key) {
        return options.get(key);
    }

    public boolean has(String key) {
        return options.containsKey(key);
    }

    /**
     * The configured port, coerced to an integer.
     *
     * @return the port, or empty if the section has none
     * @throws IllegalArgumentException if the configured value is not a valid port
     */
    public OptionalInt port() {
        Object value = options.get(PORT);
        return value == null ? OptionalInt.empty() : OptionalInt.of(Ports.coerce(value));
    }

    /** The bind host, or {@code null} for all interfaces. */
    public String host() {
        Object value = options.get(HOST);
        return value != null ? value.toString() : null;
    }

    /** Returns a copy with {@code key} set to {@code value}, replacing any existing value. */
    public ListenerConfig withOption(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(options);
        copy.put(key, value);
        return of(copy);
    }

    /** Returns a copy with {@code key} set to {@code value} only if the key is absent. */
    public ListenerConfig withDefault(String key, Object value) {
        if (options.containsKey(key)) {
            return this;
        }
        return withOption(key, value);
    }

    /**
     * Lays this section over {@code base}: every option of {@code base} not present here is
     * inherited, options present here win.
     */
    public ListenerConfig mergedOver(ListenerConfig base) {
        if (base == null || !base.enabled) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(base.options);
        merged.putAll(options);
        return of(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ListenerConfig other)) {
            return false;
        }
        return enabled == other.enabled && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(options, enabled);
    }

    @Override
    public String toString() {
        return enabled ? "ListenerConfig" + options : "ListenerConfig[disabled]";
    }
}
