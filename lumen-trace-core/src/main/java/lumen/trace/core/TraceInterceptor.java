package lumen.trace.core;

/**
 * Registered on the {@link Tracer.Builder}; receives every finalized transaction record. This is
 * the hook through which hosts export records. Exceptions thrown here are logged and ignored.
 */
public interface TraceInterceptor {

  void onTransactionFinalized(TransactionRecord record);

  /** Interceptors run in ascending priority order. */
  default int priority() {
    return 0;
  }
}
