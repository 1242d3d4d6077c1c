package com.gentoro.clm;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the application configuration: a YAML file given on the command line, or the bundled
 * {@code application.yaml}. JVM system properties with the same keys take precedence.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final CompositeConfiguration configuration;

  public ConfigurationProvider() {
    this(null);
  }

  /**
   * @param configFile path of a YAML file, or null for the bundled configuration
   */
  public ConfigurationProvider(String configFile) {
    YAMLConfiguration yaml = configFile == null ? loadResource() : loadFile(Path.of(configFile));
    this.configuration = new CompositeConfiguration();
    configuration.addConfiguration(new SystemConfiguration());
    configuration.addConfiguration(yaml, true);
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ClmException(ClmErrorCode.CONFIGURATION_ERROR, "Configuration file not found: " + path)
          .withContext("path", path.toString());
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = read(reader, path.toString());
      log.info("Loaded configuration from {}", path);
      return yaml;
    } catch (IOException e) {
      throw new ClmException(
          ClmErrorCode.CONFIGURATION_ERROR, "Failed to read configuration " + path, e);
    }
  }

  private static YAMLConfiguration loadResource() {
    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.info("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
        return new YAMLConfiguration();
      }
      YAMLConfiguration yaml =
          read(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
      log.info("Loaded configuration from classpath:{}", DEFAULT_RESOURCE);
      return yaml;
    } catch (IOException e) {
      throw new ClmException(
          ClmErrorCode.CONFIGURATION_ERROR, "Failed to read " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
      return yaml;
    } catch (ConfigurationException e) {
      throw new ClmException(
              ClmErrorCode.CONFIGURATION_ERROR, "Invalid YAML configuration in " + source, e)
          .withContext("source", source);
    }
  }
}
