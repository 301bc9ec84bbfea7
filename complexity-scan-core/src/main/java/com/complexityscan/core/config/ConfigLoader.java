package com.complexityscan.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading analyzer configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code complexity-scan.yaml} into an {@link AnalyzerConfig}
 * record. A missing, unreadable or invalid file is never fatal: a warning is logged and
 * {@link AnalyzerConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.loadForRoot(Path.of("/src/project"), null);
 * int workers = config.effectiveWorkers();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                // empty document
                log.info("Configuration file {} is empty. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }

    /**
     * Resolves the configuration for a scan root.
     *
     * <p>An explicit path wins. Otherwise {@value AnalyzerConfig#DEFAULT_FILE_NAME} in the
     * root is used when present, and defaults when not.
     *
     * @param root scanned root directory
     * @param explicitPath configuration file given by the caller, may be {@code null}
     * @return effective configuration
     */
    public static AnalyzerConfig loadForRoot(Path root, Path explicitPath) {
        if (explicitPath != null) {
            return load(explicitPath);
        }
        Path candidate = root.resolve(AnalyzerConfig.DEFAULT_FILE_NAME);
        if (Files.isRegularFile(candidate)) {
            return load(candidate);
        }
        log.debug("No {} in {}; using defaults", AnalyzerConfig.DEFAULT_FILE_NAME, root);
        return AnalyzerConfig.defaults();
    }
}
