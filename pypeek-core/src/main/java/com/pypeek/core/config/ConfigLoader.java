package com.pypeek.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading PyPeek configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code pypeek.yaml} into a {@link PeekConfig} record.
 * If the config file is missing, empty or invalid, returns {@link PeekConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PeekConfig config = ConfigLoader.load(Paths.get("pypeek.yaml"));
 * String format = config.output().format();
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up in the working directory when no config is given. */
    public static final String DEFAULT_FILE_NAME = "pypeek.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link PeekConfig#defaults()}.
     *
     * @param configPath path to {@code pypeek.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static PeekConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return PeekConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return PeekConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            PeekConfig config = YAML_MAPPER.readValue(configPath.toFile(), PeekConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return PeekConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return PeekConfig.defaults();
        }
    }

    /**
     * Loads {@code pypeek.yaml} from a directory if present, without warning when it is absent.
     *
     * @param directory directory to look in
     * @return loaded configuration or defaults
     */
    public static PeekConfig loadFromDirectory(Path directory) {
        Path candidate = directory.resolve(DEFAULT_FILE_NAME);
        if (!Files.exists(candidate)) {
            log.debug("No {} in {}. Using defaults.", DEFAULT_FILE_NAME, directory);
            return PeekConfig.defaults();
        }
        return load(candidate);
    }
}
