package com.gentoro.godex.config;

import com.gentoro.godex.exception.ConfigException;
import com.gentoro.godex.exception.SerializationException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: - "classpath:some/path.yaml" (loaded from the application
 * classpath) - absolute or relative filesystem path, or a "file:" URI. A blank location means
 * "classpath:application.yaml".
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader.getResource(resourceName) == null) {
      // Empty configuration lets every setting fall back to its default.
      log.info("Classpath resource {} not found; using defaults", resourceName);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return config;
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(reader);
      return config;
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromLocation(DEFAULT_LOCATION);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(Paths.get(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(Paths.get(loc));
  }
}
