package lumen.trace.core.propagation;

/** Contents of the {@code X-NewRelic-App-Data} response header. */
public final class CatAppData {
  private final String crossProcessId;
  private final String transactionName;
  private final float queueTimeSeconds;
  private final float responseTimeSeconds;
  private final long contentLength;
  private final String transactionGuid;
  private final boolean recordTransactionTrace;

  public CatAppData(
      String crossProcessId,
      String transactionName,
      float queueTimeSeconds,
      float responseTimeSeconds,
      long contentLength,
      String transactionGuid,
      boolean recordTransactionTrace) {
    this.crossProcessId = crossProcessId;
    this.transactionName = transactionName;
    this.queueTimeSeconds = queueTimeSeconds;
    this.responseTimeSeconds = responseTimeSeconds;
    this.contentLength = contentLength;
    this.transactionGuid = transactionGuid;
    this.recordTransactionTrace = recordTransactionTrace;
  }

  public String getCrossProcessId() {
    return crossProcessId;
  }

  public String getTransactionName() {
    return transactionName;
  }

  public float getQueueTimeSeconds() {
    return queueTimeSeconds;
  }

  public float getResponseTimeSeconds() {
    return responseTimeSeconds;
  }

  public long getContentLength() {
    return contentLength;
  }

  public String getTransactionGuid() {
    return transactionGuid;
  }

  public boolean isRecordTransactionTrace() {
    return recordTransactionTrace;
  }

  @Override
  public String toString() {
    return "CatAppData{"
        + "crossProcessId='"
        + crossProcessId
        + '\''
        + ", transactionName='"
        + transactionName
        + '\''
        + ", responseTimeSeconds="
        + responseTimeSeconds
        + '}';
  }
}
