package io.webendpoint.javalin.config;

import io.webendpoint.core.config.EndpointOverrides;
import io.webendpoint.core.spi.ConfigSource;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link ConfigSource} reading the standalone YAML file. The file is read again on every call, so
 * edits are picked up by the next {@code start} without restarting the process.
 *
 * <p>
 * A file that declares an {@code app} only answers for that application.
 */
public final class YamlConfigSource implements ConfigSource {

    private final Path configPath;
    private final Function<String, String> envLookup;

    public YamlConfigSource(Path configPath) {
        this(configPath, System::getenv);
    }

    public YamlConfigSource(Path configPath, Function<String, String> envLookup) {
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    /**
     * @throws ConfigLoadException if the file cannot be read or is invalid
     */
    @Override
    public Optional<EndpointOverrides> overrides(String appId, String endpointId) {
        StandaloneConfig config = ConfigLoader.load(configPath, envLookup);
        if (config.appId() != null && appId != null && !config.appId().equals(appId)) {
            return Optional.empty();
        }
        return config.endpoint(endpointId);
    }

    public Path configPath() {
        return configPath;
    }
}
