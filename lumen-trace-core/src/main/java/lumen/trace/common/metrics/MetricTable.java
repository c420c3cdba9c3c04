package lumen.trace.common.metrics;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps metric keys to their accumulated {@link MetricStats}. Not thread-safe: a table is owned by
 * one transaction, or by the aggregator thread, at a time. Tables cross threads only as copies.
 */
@SuppressFBWarnings(
    value = "AT_NONATOMIC_OPERATIONS_ON_SHARED_VARIABLE",
    justification = "Explicitly not thread-safe.")
public final class MetricTable {

  private final Map<MetricKey, MetricStats> stats;

  public MetricTable() {
    this.stats = new LinkedHashMap<>();
  }

  private MetricTable(int expectedSize) {
    this.stats = new LinkedHashMap<>(expectedSize * 4 / 3 + 1);
  }

  public MetricStats record(MetricKey key, long inclusiveNanos, long exclusiveNanos) {
    return statsFor(key).record(inclusiveNanos, exclusiveNanos);
  }

  public MetricStats record(String name, long inclusiveNanos, long exclusiveNanos) {
    return record(MetricKey.unscoped(name), inclusiveNanos, exclusiveNanos);
  }

  public MetricStats increment(String name) {
    return increment(name, 1);
  }

  public MetricStats increment(String name, long count) {
    return statsFor(MetricKey.unscoped(name)).increment(count);
  }

  /** Folds {@code other} into the unscoped entry for {@code name}. */
  public MetricStats merge(String name, MetricStats other) {
    return statsFor(MetricKey.unscoped(name)).merge(other);
  }

  private MetricStats statsFor(MetricKey key) {
    MetricStats existing = stats.get(key);
    if (existing == null) {
      existing = new MetricStats();
      stats.put(key, existing);
    }
    return existing;
  }

  /** Folds every entry of {@code other} into this table. */
  public MetricTable merge(MetricTable other) {
    if (other == this) {
      return merge(other.copy());
    }
    for (Map.Entry<MetricKey, MetricStats> entry : other.stats.entrySet()) {
      statsFor(entry.getKey()).merge(entry.getValue());
    }
    return this;
  }

  /** Returns a copy in which every entry is bound to {@code scope}. */
  public MetricTable rescope(String scope) {
    MetricTable scoped = new MetricTable(stats.size());
    for (Map.Entry<MetricKey, MetricStats> entry : stats.entrySet()) {
      scoped.statsFor(entry.getKey().withScope(scope)).merge(entry.getValue());
    }
    return scoped;
  }

  public MetricTable copy() {
    MetricTable copy = new MetricTable(stats.size());
    for (Map.Entry<MetricKey, MetricStats> entry : stats.entrySet()) {
      copy.stats.put(entry.getKey(), entry.getValue().copy());
    }
    return copy;
  }

  public MetricStats get(MetricKey key) {
    return stats.get(key);
  }

  /** The unscoped entry for {@code name}, or {@code null}. */
  public MetricStats get(String name) {
    return stats.get(MetricKey.unscoped(name));
  }

  public MetricStats get(String name, String scope) {
    return stats.get(new MetricKey(name, scope));
  }

  public Map<MetricKey, MetricStats> entries() {
    return Collections.unmodifiableMap(stats);
  }

  public int size() {
    return stats.size();
  }

  public boolean isEmpty() {
    return stats.isEmpty();
  }

  public void clear() {
    stats.clear();
  }

  @Override
  public String toString() {
    return "MetricTable" + stats;
  }
}
