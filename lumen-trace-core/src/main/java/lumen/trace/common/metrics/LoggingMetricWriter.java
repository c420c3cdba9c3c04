package lumen.trace.common.metrics;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes each reported bucket to the log; the default when no transport is configured. */
public class LoggingMetricWriter implements MetricWriter {

  private static final Logger log = LoggerFactory.getLogger(LoggingMetricWriter.class);

  private int expected;
  private int written;

  @Override
  public void startBucket(int metricCount, long start, long duration) {
    expected = metricCount;
    written = 0;
    log.info(
        "startBucket(metrics={}, start={}, duration={}s)",
        metricCount,
        NANOSECONDS.toMillis(start),
        NANOSECONDS.toSeconds(duration));
  }

  @Override
  public void add(MetricKey key, MetricStats stats) {
    written++;
    if (log.isDebugEnabled()) {
      log.debug("{} {}", key, stats);
    }
  }

  @Override
  public void finishBucket() {
    log.info("finishBucket({} of {} metrics)", written, expected);
  }

  @Override
  public void reset() {
    expected = 0;
    written = 0;
  }

  @Override
  public String toString() {
    return "LoggingMetricWriter { }";
  }
}
