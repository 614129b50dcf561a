package com.gentoro.lingoqueue;

import com.gentoro.lingoqueue.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the worker configuration.
 *
 * <p>Lookup order, first match wins:
 *
 * <ol>
 *   <li>environment variables named after a known key, upper-cased with {@code .} and {@code -}
 *       replaced by {@code _} ({@code worker.concurrency} becomes {@code WORKER_CONCURRENCY});
 *   <li>the optional external YAML file passed with {@code --config};
 *   <li>the bundled {@code application.yaml}.
 * </ol>
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.lingoqueue.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULTS_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(Path configFile) {
    this(configFile, System.getenv());
  }

  public ConfigurationProvider(Path configFile, Map<String, String> environment) {
    YAMLConfiguration defaults = loadDefaults();
    YAMLConfiguration external = configFile == null ? null : loadFile(configFile);

    BaseConfiguration overrides = new BaseConfiguration();
    collectOverrides(defaults, environment, overrides);
    if (external != null) {
      collectOverrides(external, environment, overrides);
    }

    CompositeConfiguration composite = new CompositeConfiguration();
    composite.addConfiguration(overrides);
    if (external != null) {
      composite.addConfiguration(external);
    }
    composite.addConfiguration(defaults);
    this.config = composite;
  }

  public Configuration config() {
    return config;
  }

  /** Environment variable name that overrides the given configuration key. */
  public static String environmentName(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  /**
   * Reads a list valued key. Accepts YAML lists and comma separated strings (the form environment
   * overrides arrive in). Blank entries are dropped.
   */
  public static List<String> getList(Configuration configuration, String key, List<String> def) {
    List<String> raw = configuration.getList(String.class, key, null);
    if (raw == null || raw.isEmpty()) {
      return def;
    }
    List<String> values = new ArrayList<>();
    for (String entry : raw) {
      if (entry == null) continue;
      for (String part : entry.split(",")) {
        if (!part.isBlank()) {
          values.add(part.trim());
        }
      }
    }
    return values.isEmpty() ? def : values;
  }

  private static void collectOverrides(
      Configuration source, Map<String, String> environment, BaseConfiguration target) {
    if (environment == null || environment.isEmpty()) {
      return;
    }
    for (Iterator<String> it = source.getKeys(); it.hasNext(); ) {
      String key = it.next();
      String value = environment.get(environmentName(key));
      if (value != null) {
        log.debug("Configuration key '{}' overridden from environment", key);
        target.setProperty(key, value);
      }
    }
  }

  private static YAMLConfiguration loadDefaults() {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new ConfigException("Missing bundled " + DEFAULTS_RESOURCE);
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      }
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
    }
    return yaml;
  }

  private static YAMLConfiguration loadFile(Path file) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file " + file, e);
    }
    log.info("Loaded configuration overrides from {}", file.toAbsolutePath());
    return yaml;
  }
}
