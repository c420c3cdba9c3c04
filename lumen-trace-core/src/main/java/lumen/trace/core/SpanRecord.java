package lumen.trace.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Immutable snapshot of a retained span and its retained children. */
public final class SpanRecord {
  private final String spanId;
  private final SpanKind kind;
  private final String name;
  private final String metricName;
  private final long startOffsetNanos;
  private final long durationNanos;
  private final long exclusiveNanos;
  private final Map<String, Object> attributes;
  private final List<String> stackTrace;
  private final boolean explainRequested;
  private final String explainPlan;
  private final String errorClass;
  private final String errorMessage;
  private final List<SpanRecord> children;

  SpanRecord(Span span, String name, long transactionStartNanos, List<SpanRecord> children) {
    this.spanId = span.spanId;
    this.kind = span.kind;
    this.name = name;
    this.metricName = span.getMetricName();
    this.startOffsetNanos = span.startNanos - transactionStartNanos;
    this.durationNanos = span.getDurationNanos();
    this.exclusiveNanos = span.getExclusiveNanos();
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(span.getAttributes()));
    this.stackTrace =
        span.getStackTrace() == null
            ? null
            : Collections.unmodifiableList(new ArrayList<>(span.getStackTrace()));
    this.explainRequested = span.isExplainRequested();
    this.explainPlan = span.getExplainPlan();
    this.errorClass = span.getErrorClass();
    this.errorMessage = span.getErrorMessage();
    this.children = Collections.unmodifiableList(children);
  }

  public String getSpanId() {
    return spanId;
  }

  public SpanKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public String getMetricName() {
    return metricName;
  }

  /** Start relative to the transaction start. */
  public long getStartOffsetNanos() {
    return startOffsetNanos;
  }

  public long getDurationNanos() {
    return durationNanos;
  }

  public long getExclusiveNanos() {
    return exclusiveNanos;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  /** Captured call stack, or {@code null} when the span was below the stack trace threshold. */
  public List<String> getStackTrace() {
    return stackTrace;
  }

  public boolean isExplainRequested() {
    return explainRequested;
  }

  public String getExplainPlan() {
    return explainPlan;
  }

  public String getErrorClass() {
    return errorClass;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public List<SpanRecord> getChildren() {
    return children;
  }

  /** Depth first search by span name, including this span. */
  public SpanRecord find(String spanName) {
    if (name.equals(spanName)) {
      return this;
    }
    for (SpanRecord child : children) {
      SpanRecord found = child.find(spanName);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  /** Number of spans in this subtree, including this one. */
  public int size() {
    int size = 1;
    for (SpanRecord child : children) {
      size += child.size();
    }
    return size;
  }

  @Override
  public String toString() {
    return "SpanRecord{"
        + "kind="
        + kind
        + ", name='"
        + name
        + '\''
        + ", metricName='"
        + metricName
        + '\''
        + ", duration="
        + durationNanos
        + ", exclusive="
        + exclusiveNanos
        + ", children="
        + children.size()
        + '}';
  }
}
