package com.gentoro.docsmcp;

import com.gentoro.docsmcp.exception.ConfigException;
import com.gentoro.docsmcp.exception.SerializationException;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), "file:/etc/docs-mcp.yaml", or an absolute/relative filesystem path. A blank
 * location means "classpath:application.yaml".
 *
 * <p>Values of the form {@code ${env:NAME}} resolve against the process environment first and then
 * against a {@code .env.local} file, which is where the document service access token usually
 * lives during local development.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Empty config keeps every getter on its default.
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file.getAbsolutePath());
    }
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      log.info("Loading configuration from file: {}", file.getAbsolutePath());
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    try {
      URI uri = URI.create(loc);
      if (uri.getScheme() != null && uri.getScheme().equalsIgnoreCase("file")) {
        return loadYamlFromFile(new File(uri));
      }
    } catch (IllegalArgumentException ignored) {
      // not a URI, treated as a plain path below
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    ConfigurationInterpolator interpolator = config.getInterpolator();
    interpolator.registerLookup("env", new EnvFileLookup());
    return config;
  }
}
