package lumen.trace.core;

import java.util.Collections;
import java.util.List;

public final class ErrorRecord {
  private final long timestampMillis;
  private final String errorClass;
  private final String message;
  private final String spanId;
  private final List<String> stackTrace;

  ErrorRecord(
      long timestampMillis,
      String errorClass,
      String message,
      String spanId,
      List<String> stackTrace) {
    this.timestampMillis = timestampMillis;
    this.errorClass = errorClass;
    this.message = message;
    this.spanId = spanId;
    this.stackTrace = Collections.unmodifiableList(stackTrace);
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  public String getErrorClass() {
    return errorClass;
  }

  public String getMessage() {
    return message;
  }

  /** The span the error was raised in, or {@code null} when noticed on the transaction. */
  public String getSpanId() {
    return spanId;
  }

  public List<String> getStackTrace() {
    return stackTrace;
  }

  @Override
  public String toString() {
    return "ErrorRecord{" + errorClass + ": " + message + '}';
  }
}
