package lumen.trace.bootstrap.config.provider;

import static lumen.trace.bootstrap.config.provider.ConfigOrigin.JVM_PROP;
import static lumen.trace.util.ConfigStrings.propertyNameToSystemPropertyName;

public final class SystemPropertiesConfigSource extends ConfigProvider.Source {
  @Override
  protected String get(String key) {
    try {
      return System.getProperty(propertyNameToSystemPropertyName(key));
    } catch (SecurityException e) {
      return null;
    }
  }

  @Override
  public ConfigOrigin origin() {
    return JVM_PROP;
  }
}
