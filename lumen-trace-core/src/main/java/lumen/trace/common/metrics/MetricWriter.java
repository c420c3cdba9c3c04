package lumen.trace.common.metrics;

public interface MetricWriter {
  /**
   * @param metricCount number of {@link #add} calls that follow
   * @param start wall clock start of the bucket, epoch nanoseconds
   * @param duration bucket length in nanoseconds
   */
  void startBucket(int metricCount, long start, long duration);

  void add(MetricKey key, MetricStats stats);

  void finishBucket();

  /** Drops a partially written bucket. */
  void reset();
}
