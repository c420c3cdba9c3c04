package lumen.trace.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A timed node in a transaction's arena. Parent and children are arena indices. Mutated only by
 * the owning {@link Transaction}; attribute writes after close are ignored.
 */
final class Span {

  static final int NO_PARENT = -1;
  private static final long OPEN = -1;

  final int index;
  final int parentIndex;
  final SpanKind kind;
  final String name;
  final String spanId;
  final long startNanos;

  private long endNanos = OPEN;
  private long childrenNanos;
  private long exclusiveNanos;

  private int[] children = new int[0];
  private int childCount;

  private final Map<String, Object> attributes = new LinkedHashMap<>();
  // unobfuscated statement, kept for explain plans only and never exported
  private String rawSql;

  private List<String> stackTrace;
  private boolean explainRequested;
  private String explainPlan;
  private String errorClass;
  private String errorMessage;
  private String metricName;

  Span(int index, int parentIndex, SpanKind kind, String name, String spanId, long startNanos) {
    this.index = index;
    this.parentIndex = parentIndex;
    this.kind = kind;
    this.name = name;
    this.spanId = spanId;
    this.startNanos = startNanos;
  }

  boolean isRoot() {
    return parentIndex == NO_PARENT;
  }

  boolean isClosed() {
    return endNanos != OPEN;
  }

  /** Sets the end time and derives exclusive time; returns the inclusive duration. */
  long close(long endTicks) {
    endNanos = Math.max(endTicks, startNanos);
    long inclusive = endNanos - startNanos;
    exclusiveNanos = Math.max(0, inclusive - childrenNanos);
    return inclusive;
  }

  void addChild(int childIndex) {
    if (childCount == children.length) {
      children = Arrays.copyOf(children, Math.max(4, childCount * 2));
    }
    children[childCount++] = childIndex;
  }

  void addChildDuration(long inclusiveNanos) {
    childrenNanos += inclusiveNanos;
  }

  int childCount() {
    return childCount;
  }

  int childAt(int i) {
    return children[i];
  }

  long getEndNanos() {
    return endNanos;
  }

  long getDurationNanos() {
    return isClosed() ? endNanos - startNanos : 0;
  }

  long getExclusiveNanos() {
    return exclusiveNanos;
  }

  boolean setAttribute(String key, Object value) {
    if (isClosed() || key == null) {
      return false;
    }
    if (value == null) {
      attributes.remove(key);
    } else {
      attributes.put(key, value);
    }
    return true;
  }

  Object getAttribute(String key) {
    return attributes.get(key);
  }

  String getStringAttribute(String key) {
    Object value = attributes.get(key);
    return value == null ? null : String.valueOf(value);
  }

  Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  String getRawSql() {
    return rawSql;
  }

  void setRawSql(String rawSql) {
    this.rawSql = rawSql;
  }

  List<String> getStackTrace() {
    return stackTrace;
  }

  void setStackTrace(List<String> stackTrace) {
    this.stackTrace = stackTrace;
  }

  boolean isExplainRequested() {
    return explainRequested;
  }

  void requestExplain() {
    explainRequested = true;
  }

  String getExplainPlan() {
    return explainPlan;
  }

  void setExplainPlan(String explainPlan) {
    this.explainPlan = explainPlan;
  }

  void setError(Throwable error) {
    errorClass = error.getClass().getName();
    errorMessage = error.getMessage();
  }

  String getErrorClass() {
    return errorClass;
  }

  String getErrorMessage() {
    return errorMessage;
  }

  String getMetricName() {
    return metricName;
  }

  void setMetricName(String metricName) {
    this.metricName = metricName;
  }

  @Override
  public String toString() {
    return "Span{"
        + "index="
        + index
        + ", parent="
        + parentIndex
        + ", kind="
        + kind
        + ", name='"
        + name
        + '\''
        + ", duration="
        + getDurationNanos()
        + '}';
  }
}
