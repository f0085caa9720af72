package com.metersentinel.core.config;

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

/**
 * Reads the monitor's YAML settings into a validated {@link SentinelConfig}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>{@value #ENV_CONFIG_PATH}, when it names an existing file</li>
 * <li>the path handed to {@link #load(String)}</li>
 * <li>the bundled {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Keys left out of a document keep the defaults declared on the settings
 * classes, so a deployment file only lists what it changes. Unknown keys,
 * duplicate keys and malformed YAML fail with an {@link IllegalStateException}
 * naming the source; out-of-range values fail in
 * {@link SentinelConfig#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    /** Classpath resource used when no override is present. */
    public static final String DEFAULT_RESOURCE = "meter-sentinel.yml";

    private ConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @param explicitPath optional file path; ignored when blank or {@code null}
     * @return parsed and validated configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static SentinelConfig load(String explicitPath) {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            if (Files.isRegularFile(Path.of(envPath))) {
                return fromFile(envPath);
            }
            LOG.warn("{} points to a missing file ({}); ignoring it", ENV_CONFIG_PATH, envPath);
        }
        if (explicitPath != null && !explicitPath.isBlank()) {
            return fromFile(explicitPath);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SentinelConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        Path file = Path.of(path);
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toAbsolutePath().toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static SentinelConfig parse(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        SentinelConfig config;
        try {
            config = new Yaml(new Constructor(SentinelConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Configuration {} is empty; using defaults", origin);
            config = new SentinelConfig();
        }
        config.validate();

        LOG.info("Loaded configuration from {}: consensus {}/5, retrain every {} day(s), keep {} version(s)",
                origin, config.getDetection().getConsensusThreshold(),
                config.getRegistry().getRetrainingIntervalDays(), config.getRegistry().getKeepVersions());
        return config;
    }
}
