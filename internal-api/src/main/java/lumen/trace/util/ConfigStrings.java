package lumen.trace.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.annotation.Nonnull;

public final class ConfigStrings {

  private ConfigStrings() {}

  public static String toEnvVar(String string) {
    return string.replace('.', '_').replace('-', '_').toUpperCase();
  }

  /**
   * Converts the property name, e.g. 'trace.max.depth' into a public environment variable name,
   * e.g. `LUMEN_TRACE_MAX_DEPTH`.
   *
   * @param setting The setting name, e.g. `trace.max.depth`
   * @return The public facing environment variable name
   */
  @Nonnull
  public static String propertyNameToEnvironmentVariableName(final String setting) {
    return "LUMEN_" + toEnvVar(setting);
  }

  /**
   * Converts the property name, e.g. 'trace.max.depth' into a public system property name, e.g.
   * `lumen.trace.max.depth`.
   *
   * @param setting The setting name, e.g. `trace.max.depth`
   * @return The public facing system property name
   */
  @Nonnull
  public static String propertyNameToSystemPropertyName(final String setting) {
    return "lumen." + setting;
  }

  @Nonnull
  public static Set<String> parseStringIntoSetOfNonEmptyStrings(final String str) {
    // Using LinkedHashSet to preserve original string order
    final Set<String> result = new LinkedHashSet<>();
    int start = 0;
    int i = 0;
    for (; i < str.length(); ++i) {
      char c = str.charAt(i);
      if (Character.isWhitespace(c) || c == ',') {
        if (i > start) {
          result.add(str.substring(start, i));
        }
        start = i + 1;
      }
    }
    if (i > start) {
      result.add(str.substring(start));
    }
    return Collections.unmodifiableSet(result);
  }
}
