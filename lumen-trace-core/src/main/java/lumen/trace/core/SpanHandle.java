package lumen.trace.core;

/**
 * Opaque reference to a span opened on a {@link Transaction}. Handles are only meaningful to the
 * transaction that issued them; operations with a foreign handle or {@link #NOOP} do nothing.
 */
public final class SpanHandle {

  /** Returned when a span could not be opened: depth or span cap reached, or a late open. */
  public static final SpanHandle NOOP = new SpanHandle(null, -1, null);

  final Transaction owner;
  final int index;
  private final String spanId;

  SpanHandle(Transaction owner, int index, String spanId) {
    this.owner = owner;
    this.index = index;
    this.spanId = spanId;
  }

  public boolean isNoop() {
    return owner == null;
  }

  /** The span id, or {@code null} for {@link #NOOP}. */
  public String getSpanId() {
    return spanId;
  }

  @Override
  public String toString() {
    return isNoop() ? "SpanHandle{noop}" : "SpanHandle{" + spanId + '}';
  }
}
