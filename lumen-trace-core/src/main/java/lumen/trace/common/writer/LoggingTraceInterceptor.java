package lumen.trace.common.writer;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.Moshi;
import lumen.trace.core.TraceInterceptor;
import lumen.trace.core.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs every finalized transaction as JSON. Useful for local debugging. */
public class LoggingTraceInterceptor implements TraceInterceptor {

  private static final Logger log = LoggerFactory.getLogger(LoggingTraceInterceptor.class);
  static final JsonAdapter<TransactionRecord> RECORD_ADAPTER =
      new Moshi.Builder()
          .add(TransactionRecordJsonAdapter.buildFactory())
          .build()
          .adapter(TransactionRecord.class);

  @Override
  public void onTransactionFinalized(final TransactionRecord record) {
    if (!log.isInfoEnabled()) {
      return;
    }
    try {
      log.info("transaction: {}", RECORD_ADAPTER.toJson(record));
    } catch (final Exception e) {
      log.error("error writing transaction: {}", record.getGuid(), e);
    }
  }

  @Override
  public int priority() {
    return Integer.MAX_VALUE;
  }

  @Override
  public String toString() {
    return "LoggingTraceInterceptor { }";
  }
}
