package com.endecrelay.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates {@link RelayConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #load(String, Map)}</li>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Environment overrides are applied and {@link RelayConfig#validate()} is
 * called before a configuration is returned, so the relay fails fast on a
 * bad file instead of at the first alert.
 * </p>
 *
 * @since 1.0.0
 */
public final class RelayConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RelayConfigLoader.class);

    /** Environment variable that can point at the configuration file. */
    public static final String ENV_CONFIG_PATH = "ENDEC_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "endec-relay.yml";

    private RelayConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * @param explicitPath path given on the command line, may be {@code null}
     * @param environment  environment variables used for the path lookup and
     *                     for overrides
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the chosen source does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RelayConfig load(String explicitPath, Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        RelayConfig config;
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading relay configuration from {}", explicitPath);
            config = read(explicitPath);
        } else {
            String envPath = environment.get(ENV_CONFIG_PATH);
            if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
                LOG.info("Loading relay configuration from environment path: {}", envPath);
                config = read(envPath);
            } else {
                LOG.info("Loading relay configuration from classpath: {}", DEFAULT_RESOURCE);
                config = readClasspath(DEFAULT_RESOURCE);
            }
        }
        config.applyEnvironment(environment);
        config.validate();
        return config;
    }

    /**
     * Load and validate a file, without environment overrides.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     */
    public static RelayConfig fromFile(String path) {
        RelayConfig config = read(path);
        config.validate();
        return config;
    }

    /**
     * Load and validate a classpath resource, without environment overrides.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     */
    public static RelayConfig fromClasspath(String resource) {
        RelayConfig config = readClasspath(resource);
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RelayConfig read(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    private static RelayConfig readClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RelayConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static RelayConfig parse(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RelayConfig.class, options));
        try {
            RelayConfig config = yaml.load(is);
            if (config == null) {
                LOG.warn("Relay configuration {} is empty; using defaults", source);
                config = new RelayConfig();
            }
            return config;
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid relay configuration in " + source + ": " + e.getMessage(), e);
        }
    }
}
