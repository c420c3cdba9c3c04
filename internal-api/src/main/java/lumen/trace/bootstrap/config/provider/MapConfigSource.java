package lumen.trace.bootstrap.config.provider;

import static lumen.trace.bootstrap.config.provider.ConfigOrigin.CODE;

import java.util.HashMap;
import java.util.Map;

/** Settings supplied in code, keyed by the un-prefixed property name. */
public final class MapConfigSource extends ConfigProvider.Source {
  private final Map<String, String> settings;

  public MapConfigSource(Map<String, String> settings) {
    this.settings = new HashMap<>(settings);
  }

  @Override
  protected String get(String key) {
    return settings.get(key);
  }

  @Override
  public ConfigOrigin origin() {
    return CODE;
  }
}
