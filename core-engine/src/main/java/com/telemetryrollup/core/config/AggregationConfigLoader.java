package com.telemetryrollup.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link AggregationConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults when neither exists</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing so a misconfigured
 * engine fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregationConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ROLLUP_CONFIG_PATH";

    static final String DEFAULT_RESOURCE = "rollup.yml";

    private AggregationConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * Load configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static AggregationConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading aggregation config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (AggregationConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading aggregation config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No aggregation config found, using defaults");
        return AggregationConfig.defaults();
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AggregationConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static AggregationConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AggregationConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static AggregationConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AggregationConfig.class, options));
        AggregationConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Aggregation config is empty, using defaults");
            config = AggregationConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
