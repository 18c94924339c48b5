package com.cutlinesight.core.config;

import com.cutlinesight.core.model.SizeCategory;
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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Loads and validates {@link AnalyticsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates the parsed configuration, so a bad
 * file stops the process at startup. A valid file is logged as a one-line
 * summary of the settings that shape the dashboard, and size categories the
 * synthetic fallback can never produce are called out with a warning.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyticsConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYTICS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "analytics.yml";

    private AnalyticsConfigLoader() {
        // utility class
    }

    /**
     * Load configuration using automatic resolution: the file named by
     * {@code ANALYTICS_CONFIG_PATH} when it exists, otherwise
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static AnalyticsConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            if (Files.exists(Path.of(envPath))) {
                LOG.info("Loading analytics config from environment path: {}", envPath);
                return fromFile(envPath);
            }
            LOG.warn("{} points to missing file {}, falling back to classpath", ENV_CONFIG_PATH, envPath);
        }
        LOG.info("Loading analytics config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalyticsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Analytics config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read analytics config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalyticsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalyticsConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalyticsConfig parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalyticsConfig.class, options));

        AnalyticsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analytics config in " + origin + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Analytics config {} is empty, using defaults", origin);
            config = AnalyticsConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded analytics config from {}: {}", origin, summarize(config));
        List<SizeCategory> unweighted = unweightedCategories(config);
        if (!unweighted.isEmpty()) {
            LOG.warn("Synthetic sessions from {} will contain no {} detections", origin, labels(unweighted));
        }
        LOG.debug("Full analytics config: {}", config);
        return config;
    }

    /**
     * @param config a validated configuration
     * @return one-line description of the settings visible on the dashboard
     */
    static String summarize(AnalyticsConfig config) {
        AnalyticsConfig.IngestSettings ingest = config.getIngest();
        return "source '" + ingest.getDefaultSource() + "'"
                + ", timestamps in " + ingest.zoneId().getId()
                + ", " + config.getSynthetic().getEventCount() + " synthetic events"
                + ", default threshold " + Math.round(config.getDisplay().defaultThreshold().getValue() * 100) + "%";
    }

    /**
     * @param config a validated configuration
     * @return categories with zero synthetic weight, in declaration order
     */
    static List<SizeCategory> unweightedCategories(AnalyticsConfig config) {
        return config.getSynthetic().categoryWeights().entrySet().stream()
                .filter(e -> e.getValue() == 0.0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static String labels(List<SizeCategory> categories) {
        return categories.stream().map(SizeCategory::getLabel).collect(Collectors.joining("/"));
    }
}
