package org.mibig.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ConverterConfig} from YAML.
 *
 * <p>A missing or unparsable file is not an error: the loader logs it and returns
 * {@link ConverterConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConverterConfig config = ConfigLoader.load(Path.of("mibig.yaml"));
 * boolean pretty = config.output().prettyPrint();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "mibig.yaml";

    /**
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static ConverterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ConverterConfig config = YAML_MAPPER.readValue(configPath.toFile(), ConverterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ConverterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ConverterConfig.defaults();
        }
    }
}
