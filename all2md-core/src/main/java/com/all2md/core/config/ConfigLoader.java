package com.all2md.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading all2md configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code all2md.yaml} into {@link All2MdConfig} records.
 * If the config file is missing or invalid, returns {@link All2MdConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * All2MdConfig config = ConfigLoader.load(Path.of("all2md.yaml"));
 * int depth = config.toc().maxDepth();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "all2md.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link All2MdConfig#defaults()}.
     *
     * @param configPath path to {@code all2md.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static All2MdConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return All2MdConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return All2MdConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            All2MdConfig config = YAML_MAPPER.readValue(configPath.toFile(), All2MdConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return All2MdConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return All2MdConfig.defaults();
        }
    }
}
