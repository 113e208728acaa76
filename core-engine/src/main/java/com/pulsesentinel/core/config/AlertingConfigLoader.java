package com.pulsesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates the alerting seed configuration from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Parsing</h3>
 * <p>
 * SnakeYAML parses the document into plain maps and lists with a
 * {@link SafeConstructor}; Jackson then binds that tree onto
 * {@link AlertingConfig} so YAML and JSON share one set of property names.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link AlertingConfig#validate()} so that the
 * service <strong>fails fast</strong> on a broken seed file.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertingConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertingConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ALERTING_CONFIG_PATH";

    /** Default classpath resource. */
    public static final String DEFAULT_RESOURCE = "alerting.yml";

    private AlertingConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * Load configuration using automatic resolution: {@code ALERTING_CONFIG_PATH}
     * if set and present, otherwise {@code alerting.yml} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static AlertingConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alerting config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading alerting config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path file system path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AlertingConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alerting config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerting config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AlertingConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertingConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AlertingConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object tree = yaml.load(is);

        AlertingConfig config;
        if (tree == null) {
            LOG.warn("Alerting configuration is empty");
            config = new AlertingConfig();
        } else {
            try {
                config = JsonSupport.mapper().convertValue(tree, AlertingConfig.class);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Malformed alerting configuration: " + e.getMessage(), e);
            }
            config.validate();
        }

        LOG.info("Loaded alerting configuration: {}", config);
        return config;
    }
}
