package com.columnhierarchy.core.config;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code column-hierarchy.yaml} into {@link ProjectConfig}.
 *
 * <p>Two entry points share one reading path. {@link #parse(Path)} is strict and reports
 * the first problem, which is what {@code validate} needs. {@link #load(Path)} is lenient:
 * a resolution run never fails because of its configuration file, it logs the problem
 * and carries on with {@link ProjectConfig#defaults()}.
 *
 * <p>A file only counts as valid when its values make sense too: the resolution settings
 * must build and the mode must be known.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_CONFIG_FILE = "column-hierarchy.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration, falling back to defaults on any problem.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration, or defaults if the file is absent or invalid
     */
    public static ProjectConfig load(Path configPath) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            log.warn("No configuration file at {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            ProjectConfig config = parse(configPath);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | InvalidInputException e) {
            log.error("Ignoring configuration file {}: {}. Using defaults.", configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    /**
     * Parses and checks a configuration file.
     *
     * @param configPath path to the configuration file
     * @return parsed configuration
     * @throws IOException if the file cannot be read, is empty, or is not valid YAML
     * @throws InvalidInputException if a configured value is out of range or unknown
     */
    public static ProjectConfig parse(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new IOException("Not a readable file: " + configPath);
        }
        if (Files.size(configPath) == 0) {
            throw new IOException("Configuration file is empty: " + configPath);
        }

        log.debug("Parsing configuration: {}", configPath);
        ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        if (config == null) {
            throw new IOException("Configuration file has no content: " + configPath);
        }

        ResolutionSettings settings = config.toResolutionSettings();
        log.debug("Configuration {} resolves {} with {}", configPath, config.effectiveMode(), settings);
        return config;
    }
}
