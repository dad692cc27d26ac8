package com.semanticdiff.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code semanticdiff.yaml} into {@link SemanticDiffConfig}.
 * If the file is missing or invalid, returns {@link SemanticDiffConfig#defaults()}; loading
 * never throws.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SemanticDiffConfig config = ConfigLoader.load(Path.of("semanticdiff.yaml"));
 * CrossModelConflictAnalyzer analyzer =
 *     new CrossModelConflictAnalyzer(config.analyzer().toSettings());
 * }</pre>
 */
public final class ConfigLoader {

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "semanticdiff.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code semanticdiff.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SemanticDiffConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return SemanticDiffConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SemanticDiffConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SemanticDiffConfig config = YAML_MAPPER.readValue(configPath.toFile(), SemanticDiffConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SemanticDiffConfig.defaults();
            }
            // rejects a similarity threshold outside 0..1
            config.analyzer().toSettings();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SemanticDiffConfig.defaults();
        }
    }
}
