package com.processlens.core.config;

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
 * Reads the engine's tunables from YAML.
 *
 * <p>
 * {@link #load()} looks for a file named by {@value #ENV_CONFIG_PATH}, then
 * for {@value #DEFAULT_RESOURCE} on the classpath, and otherwise returns
 * {@link AnalysisConfig#defaults()}. Keys missing from a file keep their
 * default value; an empty document yields the defaults. Duplicate keys are a
 * parse error.
 * </p>
 *
 * <p>
 * Whatever the source, the result has passed {@link AnalysisConfig#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Names a YAML file that takes precedence over the bundled resource. */
    public static final String ENV_CONFIG_PATH = "PROCESSLENS_CONFIG_PATH";

    /** Bundled configuration resource. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private AnalysisConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * @return the configuration named by the environment, the bundled one, or
     *         the defaults, in that order of preference
     * @throws IllegalStateException if the chosen document is malformed or
     *                               holds invalid values
     */
    public static AnalysisConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            if (Files.isRegularFile(Path.of(envPath))) {
                return fromFile(envPath);
            }
            LOG.warn("{} points to '{}', which is not a file; ignoring it", ENV_CONFIG_PATH, envPath);
        }
        if (AnalysisConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No analysis configuration found, running with defaults");
        AnalysisConfig config = AnalysisConfig.defaults();
        config.validate();
        return config;
    }

    /**
     * @param path YAML file
     * @return the validated configuration
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the file cannot be read, parsed or
     *                                  validated
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return read(in, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Analysis config file does not exist: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("I/O error reading analysis config " + path, e);
        }
    }

    /**
     * @param resource resource name relative to the classpath root
     * @return the validated configuration
     * @throws IllegalArgumentException if the resource is absent
     * @throws IllegalStateException    if it cannot be read, parsed or
     *                                  validated
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Analysis config resource does not exist on the classpath: "
                    + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("I/O error reading analysis config classpath:" + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private static AnalysisConfig read(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        AnalysisConfig config;
        try {
            config = new Yaml(new Constructor(AnalysisConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis config " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Analysis config {} is empty; defaults apply", origin);
            config = AnalysisConfig.defaults();
        }
        config.validate();
        LOG.info("Analysis config from {}: {}", origin, config);
        return config;
    }
}
