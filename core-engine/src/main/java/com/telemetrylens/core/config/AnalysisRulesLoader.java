package com.telemetrylens.core.config;

import com.telemetrylens.core.error.InvalidParameterException;
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
 * Loads and validates {@link AnalysisRulesConfig} from a YAML source.
 *
 * <p>
 * {@link #load()} reads the file named by {@value #ENV_RULES_PATH} and falls
 * back to the classpath resource {@value #DEFAULT_RESOURCE}. Rules are
 * validated after parsing.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisRulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisRulesLoader.class);

    public static final String ENV_RULES_PATH = "ANALYSIS_RULES_PATH";

    public static final String DEFAULT_RESOURCE = "analysis-rules.yml";

    private AnalysisRulesLoader() {
        // utility class, not instantiable
    }

    /**
     * Load rules using automatic resolution: the file named by
     * {@value #ENV_RULES_PATH} when it exists, else the classpath default.
     *
     * @return parsed and validated rules configuration
     */
    public static AnalysisRulesConfig load() {
        return load(System.getenv(ENV_RULES_PATH));
    }

    /**
     * Load from {@code path} when it names an existing file, else from the
     * classpath default.
     *
     * @param path optional file system path; may be {@code null} or blank
     */
    public static AnalysisRulesConfig load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading analysis rules from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading analysis rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @throws IllegalArgumentException  if the file does not exist
     * @throws IllegalStateException     if reading or parsing fails
     * @throws InvalidParameterException if rule validation fails
     */
    public static AnalysisRulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parseAndValidate(is);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @throws IllegalArgumentException  if the resource does not exist
     * @throws IllegalStateException     if reading or parsing fails
     * @throws InvalidParameterException if rule validation fails
     */
    public static AnalysisRulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisRulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static AnalysisRulesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisRulesConfig.class, options));

        AnalysisRulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis rules YAML: " + e.getMessage(), e);
        }

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No analysis rules defined in configuration");
            config = new AnalysisRulesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} analysis rule(s)", config.getRules().size());
        return config;
    }
}
