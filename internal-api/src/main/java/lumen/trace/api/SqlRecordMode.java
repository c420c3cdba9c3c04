package lumen.trace.api;

import java.util.Locale;

/** How SQL text is kept on database spans. */
public enum SqlRecordMode {
  OBFUSCATED,
  RAW,
  OFF;

  static SqlRecordMode parse(String value, SqlRecordMode defaultMode) {
    if (value == null) {
      return defaultMode;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return defaultMode;
    }
  }
}
