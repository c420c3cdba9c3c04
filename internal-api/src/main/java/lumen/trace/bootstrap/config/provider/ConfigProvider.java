package lumen.trace.bootstrap.config.provider;

import static lumen.trace.util.ConfigStrings.parseStringIntoSetOfNonEmptyStrings;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves settings from an ordered list of sources. The first source returning a non-null value
 * for a key wins; invalid values fall back to the supplied default.
 */
public final class ConfigProvider {

  private static final Logger log = LoggerFactory.getLogger(ConfigProvider.class);

  private final Source[] sources;

  private ConfigProvider(Source... sources) {
    this.sources = sources;
  }

  public static ConfigProvider createDefault() {
    return new ConfigProvider(new SystemPropertiesConfigSource(), new EnvironmentConfigSource());
  }

  /** Settings in {@code overrides} take precedence over system properties and environment. */
  public static ConfigProvider withOverrides(Map<String, String> overrides) {
    return new ConfigProvider(
        new MapConfigSource(overrides),
        new SystemPropertiesConfigSource(),
        new EnvironmentConfigSource());
  }

  /** Only the given settings are visible; used where the environment must not leak in. */
  public static ConfigProvider of(Map<String, String> settings) {
    return new ConfigProvider(new MapConfigSource(settings));
  }

  public static ConfigProvider withSources(Source... sources) {
    return new ConfigProvider(Arrays.copyOf(sources, sources.length));
  }

  public String getString(String key) {
    return getString(key, null);
  }

  public String getString(String key, String defaultValue) {
    for (Source source : sources) {
      String value = source.get(key);
      if (value != null) {
        value = value.trim();
        if (!value.isEmpty()) {
          if (log.isDebugEnabled()) {
            log.debug("{} resolved from {}", key, source.origin().value);
          }
          return value;
        }
      }
    }
    return defaultValue;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    if ("1".equals(value) || "true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("0".equals(value) || "false".equalsIgnoreCase(value)) {
      return false;
    }
    log.warn(
        "Invalid configuration for {}: '{}' is not a boolean, using {}", key, value, defaultValue);
    return defaultValue;
  }

  public int getInteger(String key, int defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn(
          "Invalid configuration for {}: '{}' is not an int, using {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  public long getLong(String key, long defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn(
          "Invalid configuration for {}: '{}' is not a long, using {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  /** Comma or whitespace separated values; an unset key yields {@code defaultValue}. */
  public Set<String> getSet(String key, String defaultValue) {
    String value = getString(key, defaultValue);
    if (value == null) {
      return Collections.emptySet();
    }
    return parseStringIntoSetOfNonEmptyStrings(value);
  }

  public abstract static class Source {
    protected abstract String get(String key);

    public abstract ConfigOrigin origin();
  }
}
