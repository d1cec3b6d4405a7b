package com.fleetsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the engine's YAML document into an {@link EngineConfig}.
 *
 * <p>
 * {@link #load()} prefers a file named by {@value #ENV_CONFIG_PATH} and falls
 * back to the bundled {@value #DEFAULT_RESOURCE}. The document binds straight
 * onto the settings beans; duplicate keys are rejected and an empty document
 * yields the defaults. The result is always validated before it is returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "ANOMALY_ENGINE_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "anomaly-engine.yml";

    private EngineConfigLoader() {
    }

    /**
     * Configuration for a running engine.
     *
     * @throws IllegalStateException if the chosen document is unreadable, malformed or invalid
     */
    public static EngineConfig load() {
        Optional<Path> override = overridePath();
        if (override.isPresent()) {
            return fromPath(override.get());
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the document is unreadable, malformed or invalid
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        return fromPath(Path.of(path));
    }

    /**
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the document is unreadable, malformed or invalid
     */
    public static EngineConfig fromPath(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(path.toString(), in);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read engine configuration " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the document is unreadable, malformed or invalid
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return read("classpath:" + resource, in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read engine configuration classpath:" + resource, e);
        }
    }

    private static Optional<Path> overridePath() {
        String value = System.getenv(ENV_CONFIG_PATH);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(value.trim());
        if (!Files.isRegularFile(path)) {
            LOG.warn("{} points at {}, which is not a file; using classpath:{}",
                    ENV_CONFIG_PATH, path, DEFAULT_RESOURCE);
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private static EngineConfig read(String origin, InputStream in) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));

        EngineConfig config;
        try {
            config = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine configuration in " + origin + ": "
                    + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Engine configuration {} is empty, using defaults", origin);
            config = new EngineConfig();
        }
        config.validate();
        LOG.info("Engine configuration from {}: {}", origin, config);
        return config;
    }
}
