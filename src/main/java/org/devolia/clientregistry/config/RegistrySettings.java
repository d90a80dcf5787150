package org.devolia.clientregistry.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.io.IOException;
import java.net.URL;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry configuration backed by SmallRye Config.
 *
 * <p>Keys are read under the {@code client-registry.} prefix. A key such as {@code cache.ttl}
 * resolves, highest ordinal first, from:
 *
 * <ol>
 *   <li>system property {@code client-registry.cache.ttl} (ordinal 400)
 *   <li>environment variable {@code CLIENT_REGISTRY_CACHE_TTL} (ordinal 300)
 *   <li>classpath resource {@code client-registry.properties} (ordinal 100)
 * </ol>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class RegistrySettings {

  private static final Logger logger = LoggerFactory.getLogger(RegistrySettings.class);

  public static final String DEFAULT_RESOURCE = "client-registry.properties";
  static final String PREFIX = "client-registry.";
  static final int RESOURCE_ORDINAL = 100;

  private final SmallRyeConfig config;

  RegistrySettings(SmallRyeConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  /**
   * Loads settings from system properties, the environment and the default classpath resource.
   *
   * @return the settings
   * @throws IllegalStateException if the classpath resource cannot be read
   */
  public static RegistrySettings load() {
    SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder().addDefaultSources();

    URL resource = RegistrySettings.class.getClassLoader().getResource(DEFAULT_RESOURCE);
    if (resource != null) {
      try {
        builder.withSources(new PropertiesConfigSource(resource, RESOURCE_ORDINAL));
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
      }
      logger.debug("Loaded settings from {}", resource);
    } else {
      logger.debug("No {} on the classpath", DEFAULT_RESOURCE);
    }

    return new RegistrySettings(builder.build());
  }

  /**
   * Creates settings from explicit values only, ignoring system properties and the environment.
   *
   * @param values key/value pairs using the unprefixed key names
   * @return the settings
   */
  public static RegistrySettings of(Map<String, String> values) {
    Map<String, String> prefixed = new HashMap<>();
    values.forEach((key, value) -> prefixed.put(PREFIX + key, value));

    return new RegistrySettings(
        new SmallRyeConfigBuilder()
            .withSources(
                new PropertiesConfigSource(prefixed, "client-registry-values", RESOURCE_ORDINAL))
            .build());
  }

  /**
   * Gets a value.
   *
   * @param key the unprefixed key, for example {@code db.url}
   * @return the trimmed value, or null if not configured or blank
   */
  public String get(String key) {
    return config
        .getOptionalValue(PREFIX + key, String.class)
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .orElse(null);
  }

  /**
   * Gets a value with a default.
   *
   * @param key the unprefixed key
   * @param defaultValue the value when not configured
   * @return the value
   */
  public String get(String key, String defaultValue) {
    String value = get(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Gets an integer value.
   *
   * @param key the unprefixed key
   * @param defaultValue the value when not configured
   * @return the value
   * @throws IllegalArgumentException if the configured value is not an integer
   */
  public int getInt(String key, int defaultValue) {
    return config.getOptionalValue(PREFIX + key, Integer.class).orElse(defaultValue);
  }

  /**
   * Gets a long value.
   *
   * @param key the unprefixed key
   * @param defaultValue the value when not configured
   * @return the value
   * @throws IllegalArgumentException if the configured value is not a number
   */
  public long getLong(String key, long defaultValue) {
    return config.getOptionalValue(PREFIX + key, Long.class).orElse(defaultValue);
  }

  /**
   * Gets a boolean value, using SmallRye's conversion ({@code true}, {@code yes}, {@code on} or
   * {@code 1} in any case read as true).
   *
   * @param key the unprefixed key
   * @param defaultValue the value when not configured
   * @return the value
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    return config.getOptionalValue(PREFIX + key, Boolean.class).orElse(defaultValue);
  }
}
