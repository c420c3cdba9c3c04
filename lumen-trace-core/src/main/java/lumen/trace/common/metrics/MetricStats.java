package lumen.trace.common.metrics;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Not thread-safe. Accumulates call counts and durations for one metric key.
 *
 * <p>Durations are kept in nanoseconds; the sum of squares is kept over inclusive seconds so it
 * stays within double precision for long running series.
 */
@SuppressFBWarnings(
    value = {"AT_NONATOMIC_OPERATIONS_ON_SHARED_VARIABLE", "AT_STALE_THREAD_WRITE_OF_PRIMITIVE"},
    justification = "Explicitly not thread-safe. Accumulates counts and durations.")
public final class MetricStats {

  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private long callCount;
  private long totalNanos;
  private long exclusiveNanos;
  private long minNanos = Long.MAX_VALUE;
  private long maxNanos;
  private double sumOfSquares;

  public MetricStats() {}

  /** Records one call. Exclusive time is clamped to {@code [0, inclusive]}. */
  public MetricStats record(long inclusiveNanos, long exclusiveNanos) {
    long inclusive = Math.max(0, inclusiveNanos);
    long exclusive = Math.min(inclusive, Math.max(0, exclusiveNanos));
    ++callCount;
    totalNanos += inclusive;
    this.exclusiveNanos += exclusive;
    minNanos = Math.min(minNanos, inclusive);
    maxNanos = Math.max(maxNanos, inclusive);
    double seconds = inclusive / NANOS_PER_SECOND;
    sumOfSquares += seconds * seconds;
    return this;
  }

  /** Adds a count with no timing, used for counter style metrics such as error counts. */
  public MetricStats increment(long count) {
    callCount += count;
    if (minNanos == Long.MAX_VALUE) {
      minNanos = 0;
    }
    return this;
  }

  /** Folds {@code other} into this instance; commutative and associative. */
  public MetricStats merge(MetricStats other) {
    if (other.callCount == 0) {
      return this;
    }
    callCount += other.callCount;
    totalNanos += other.totalNanos;
    exclusiveNanos += other.exclusiveNanos;
    minNanos = Math.min(minNanos, other.minNanos);
    maxNanos = Math.max(maxNanos, other.maxNanos);
    sumOfSquares += other.sumOfSquares;
    return this;
  }

  public MetricStats copy() {
    return new MetricStats().merge(this);
  }

  public long getCallCount() {
    return callCount;
  }

  public long getTotalNanos() {
    return totalNanos;
  }

  public long getExclusiveNanos() {
    return exclusiveNanos;
  }

  public long getMinNanos() {
    return callCount == 0 ? 0 : minNanos;
  }

  public long getMaxNanos() {
    return maxNanos;
  }

  public double getSumOfSquares() {
    return sumOfSquares;
  }

  @SuppressFBWarnings("AT_NONATOMIC_64BIT_PRIMITIVE")
  public void clear() {
    callCount = 0;
    totalNanos = 0;
    exclusiveNanos = 0;
    minNanos = Long.MAX_VALUE;
    maxNanos = 0;
    sumOfSquares = 0;
  }

  @Override
  public String toString() {
    return "MetricStats{"
        + "count="
        + callCount
        + ", total="
        + totalNanos
        + ", exclusive="
        + exclusiveNanos
        + ", min="
        + getMinNanos()
        + ", max="
        + maxNanos
        + ", sumOfSquares="
        + sumOfSquares
        + '}';
  }
}
