package lumen.trace.bootstrap.config.provider;

import static lumen.trace.bootstrap.config.provider.ConfigOrigin.ENV;
import static lumen.trace.util.ConfigStrings.propertyNameToEnvironmentVariableName;

final class EnvironmentConfigSource extends ConfigProvider.Source {
  @Override
  protected String get(String key) {
    try {
      return System.getenv(propertyNameToEnvironmentVariableName(key));
    } catch (SecurityException e) {
      return null;
    }
  }

  @Override
  public ConfigOrigin origin() {
    return ENV;
  }
}
