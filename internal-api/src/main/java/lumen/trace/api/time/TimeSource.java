package lumen.trace.api.time;

public interface TimeSource {
  /** Monotonic ticks in nanoseconds, only meaningful as a difference. */
  long getNanoTicks();

  long getCurrentTimeMillis();
}
