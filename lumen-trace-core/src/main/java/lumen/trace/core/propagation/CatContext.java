package lumen.trace.core.propagation;

/**
 * Legacy cross application tracing identifiers. Inbound, {@code crossProcessId} names the calling
 * application; outbound, it names this one.
 */
public final class CatContext {
  private final String crossProcessId;
  private final String transactionGuid;
  private final boolean recordTransactionTrace;
  private final String tripId;
  private final String pathHash;

  public CatContext(
      String crossProcessId,
      String transactionGuid,
      boolean recordTransactionTrace,
      String tripId,
      String pathHash) {
    this.crossProcessId = crossProcessId;
    this.transactionGuid = transactionGuid;
    this.recordTransactionTrace = recordTransactionTrace;
    this.tripId = tripId;
    this.pathHash = pathHash;
  }

  public String getCrossProcessId() {
    return crossProcessId;
  }

  /** Account part of {@code account#application}, or {@code null}. */
  public String getAccountId() {
    if (crossProcessId == null) {
      return null;
    }
    int hash = crossProcessId.indexOf('#');
    return hash <= 0 ? null : crossProcessId.substring(0, hash);
  }

  public String getTransactionGuid() {
    return transactionGuid;
  }

  public boolean isRecordTransactionTrace() {
    return recordTransactionTrace;
  }

  public String getTripId() {
    return tripId;
  }

  public String getPathHash() {
    return pathHash;
  }

  @Override
  public String toString() {
    return "CatContext{"
        + "crossProcessId='"
        + crossProcessId
        + '\''
        + ", transactionGuid='"
        + transactionGuid
        + '\''
        + ", tripId='"
        + tripId
        + '\''
        + ", pathHash='"
        + pathHash
        + '\''
        + '}';
  }
}
