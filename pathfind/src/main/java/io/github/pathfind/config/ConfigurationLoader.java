package io.github.pathfind.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.pathfind.exception.ConfigurationException;
import io.github.pathfind.model.Configuration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON configuration file.
 */
public class ConfigurationLoader {

  /**
   * Environment variable naming the configuration file.
   */
  public static final String CONFIG_ENV = "PATHFIND_CONFIG";

  private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new configuration loader.
   *
   * @param objectMapper the object mapper
   */
  public ConfigurationLoader(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Load the configuration.
   *
   * @param path the file; may be null when nothing was given on the command line or environment
   * @return the configuration
   * @throws ConfigurationException if the file is missing or invalid
   */
  public Configuration load(final Path path) {
    if (path == null) {
      throw new ConfigurationException("No configuration file given; use --config or set " + CONFIG_ENV);
    }
    if (!Files.isReadable(path)) {
      throw new ConfigurationException("Can't read configuration file " + path);
    }
    log.debug("Loading configuration from {}", path);
    try {
      return objectMapper.readValue(path.toFile(), Configuration.class);
    } catch (IOException e) {
      throw new ConfigurationException("Invalid configuration file " + path + ": " + e.getMessage(), e);
    }
  }
}
