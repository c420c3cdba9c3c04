package lumen.trace.core.propagation;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class PropagationUtils {

  static final String TRACE_PARENT_KEY = "traceparent";
  static final int TRACE_PARENT_TID_START = 2 + 1;
  static final int TRACE_PARENT_TID_END = TRACE_PARENT_TID_START + 32;
  static final int TRACE_PARENT_SID_START = TRACE_PARENT_TID_END + 1;
  static final int TRACE_PARENT_SID_END = TRACE_PARENT_SID_START + 16;
  static final int TRACE_PARENT_FLAGS_START = TRACE_PARENT_SID_END + 1;
  static final int TRACE_PARENT_LENGTH = TRACE_PARENT_FLAGS_START + 2;

  private PropagationUtils() {}

  public static String traceParent(String traceId, String spanId, boolean sampled) {
    StringBuilder sb = new StringBuilder(TRACE_PARENT_LENGTH);
    sb.append("00-");
    sb.append(traceId);
    sb.append("-");
    sb.append(spanId);
    sb.append(sampled ? "-01" : "-00");
    return sb.toString();
  }

  /** At most six decimals, no trailing zeros: {@code 1.5}, {@code 0.123457}. */
  static String formatPriority(float priority) {
    return new BigDecimal(Float.toString(priority))
        .setScale(6, RoundingMode.HALF_UP)
        .stripTrailingZeros()
        .toPlainString();
  }

  /** @return the priority, or {@code null} when empty or not a finite number */
  static Float parsePriority(String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      float priority = Float.parseFloat(value);
      return Float.isNaN(priority) || Float.isInfinite(priority) ? null : priority;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** tracestate encodes the parent type as a number. */
  static String parentTypeCode(String parentType) {
    if ("Browser".equals(parentType)) {
      return "1";
    } else if ("Mobile".equals(parentType)) {
      return "2";
    }
    return "0";
  }

  static String parentTypeName(String code) {
    switch (code) {
      case "0":
        return "App";
      case "1":
        return "Browser";
      case "2":
        return "Mobile";
      default:
        return null;
    }
  }
}
