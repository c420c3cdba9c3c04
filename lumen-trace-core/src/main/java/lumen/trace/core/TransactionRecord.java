package lumen.trace.core;

import java.util.Collections;
import java.util.List;
import lumen.trace.common.metrics.MetricStats;
import lumen.trace.common.metrics.MetricTable;

/**
 * The exported result of a finalized {@link Transaction}: identity, timing, the pruned span tree,
 * a metric snapshot and the sampling decision. Never mutated after construction: metric accessors
 * hand out copies.
 */
public final class TransactionRecord {
  private final String guid;
  private final String name;
  private final String metricName;
  private final boolean web;
  private final long startTimeMillis;
  private final long durationNanos;
  private final SpanRecord root;
  private final MetricTable metrics;
  private final boolean sampled;
  private final float priority;
  private final String traceId;
  private final String parentSpanId;
  private final List<ErrorRecord> errors;
  private final int droppedSpanCount;

  TransactionRecord(
      String guid,
      String name,
      String metricName,
      boolean web,
      long startTimeMillis,
      long durationNanos,
      SpanRecord root,
      MetricTable metrics,
      boolean sampled,
      float priority,
      String traceId,
      String parentSpanId,
      List<ErrorRecord> errors,
      int droppedSpanCount) {
    this.guid = guid;
    this.name = name;
    this.metricName = metricName;
    this.web = web;
    this.startTimeMillis = startTimeMillis;
    this.durationNanos = durationNanos;
    this.root = root;
    this.metrics = metrics;
    this.sampled = sampled;
    this.priority = priority;
    this.traceId = traceId;
    this.parentSpanId = parentSpanId;
    this.errors = Collections.unmodifiableList(errors);
    this.droppedSpanCount = droppedSpanCount;
  }

  public String getGuid() {
    return guid;
  }

  public String getName() {
    return name;
  }

  public String getMetricName() {
    return metricName;
  }

  public boolean isWeb() {
    return web;
  }

  public long getStartTimeMillis() {
    return startTimeMillis;
  }

  public long getDurationNanos() {
    return durationNanos;
  }

  public SpanRecord getRoot() {
    return root;
  }

  /** A copy of the recorded metrics; changes to it are not seen by this record. */
  public MetricTable getMetrics() {
    return metrics.copy();
  }

  /** Copy of the unscoped entry for {@code metricName}, or {@code null}. */
  public MetricStats getMetric(String metricName) {
    return copyOf(metrics.get(metricName));
  }

  /** Copy of the entry for {@code metricName} scoped to this transaction, or {@code null}. */
  public MetricStats getScopedMetric(String metricName) {
    return copyOf(metrics.get(metricName, this.metricName));
  }

  private static MetricStats copyOf(MetricStats stats) {
    return null == stats ? null : stats.copy();
  }

  public boolean isSampled() {
    return sampled;
  }

  public float getPriority() {
    return priority;
  }

  public String getTraceId() {
    return traceId;
  }

  /** Inbound parent span id, or {@code null} when this transaction started its own trace. */
  public String getParentSpanId() {
    return parentSpanId;
  }

  public List<ErrorRecord> getErrors() {
    return errors;
  }

  /** Span opens refused by the depth cap, the span cap, or because the transaction had ended. */
  public int getDroppedSpanCount() {
    return droppedSpanCount;
  }

  @Override
  public String toString() {
    return "TransactionRecord{"
        + "guid='"
        + guid
        + '\''
        + ", metricName='"
        + metricName
        + '\''
        + ", duration="
        + durationNanos
        + ", spans="
        + root.size()
        + ", metrics="
        + metrics.size()
        + ", sampled="
        + sampled
        + '}';
  }
}
