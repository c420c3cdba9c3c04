package lumen.trace.common.metrics;

import java.util.concurrent.Future;
import lumen.trace.core.TransactionRecord;

/** Process-wide consumer of finalized transaction records. */
public interface MetricsAggregator extends AutoCloseable {
  void start();

  /** Asks for the rollups to be flushed at the next opportunity. */
  boolean report();

  Future<Boolean> forceReport();

  /** Queues the record's metrics; never blocks and never rejects. */
  void submit(TransactionRecord record);

  /** Queues metrics recorded outside any transaction; the table must not be used afterwards. */
  void submit(MetricTable metrics);

  @Override
  void close();
}
