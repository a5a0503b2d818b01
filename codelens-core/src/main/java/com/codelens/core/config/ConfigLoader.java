package com.codelens.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading CodeLens configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codelens.yaml} into {@link CodeLensConfig} records.
 * If the config file is missing or invalid, returns {@link CodeLensConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeLensConfig config = ConfigLoader.load(Paths.get("codelens.yaml"));
 * ProjectAnalyzer analyzer = new ProjectAnalyzer(config);
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "codelens.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CodeLensConfig#defaults()}.
     *
     * @param configPath path to {@code codelens.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CodeLensConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CodeLensConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodeLensConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CodeLensConfig config = YAML_MAPPER.readValue(configPath.toFile(), CodeLensConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CodeLensConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CodeLensConfig.defaults();
        }
    }
}
