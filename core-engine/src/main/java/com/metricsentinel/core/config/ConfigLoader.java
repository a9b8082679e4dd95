package com.metricsentinel.core.config;

import com.metricsentinel.core.error.ConfigurationException;
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
import java.util.Objects;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link AnalysisConfig#validate()} after
 * parsing, so a bad sensitivity or window fails at startup rather than in the
 * middle of a scheduled run.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYSIS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private ConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution: the file named by
     * {@code ANALYSIS_CONFIG_PATH} when it exists, otherwise
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public static AnalysisConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analysis config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading analysis config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if the file is missing, unreadable or
     *                                invalid
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new ConfigurationException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if the resource is missing, unreadable or
     *                                invalid
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisConfig.class, options));

        AnalysisConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed analysis config in " + origin + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Analysis config {} is empty – using defaults", origin);
            config = new AnalysisConfig();
        }
        config.validate();

        LOG.info("Loaded analysis config: {} cost source(s), {} log source(s)",
                config.getCost().getSources().size(), config.getLogs().getSources().size());
        return config;
    }
}
