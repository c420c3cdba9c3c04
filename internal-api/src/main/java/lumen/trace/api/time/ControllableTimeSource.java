package lumen.trace.api.time;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.util.concurrent.TimeUnit;

/** Manually advanced clock; wall time moves in step with the ticks. */
public class ControllableTimeSource implements TimeSource {
  private long currentTicks = 0;
  private long epochMillisAtZero = 1_700_000_000_000L;

  public void advance(long nanosIncrement) {
    currentTicks += nanosIncrement;
  }

  public void advance(long amount, TimeUnit unit) {
    advance(unit.toNanos(amount));
  }

  public void set(long nanos) {
    currentTicks = nanos;
  }

  public void setEpochMillisAtZero(long epochMillis) {
    epochMillisAtZero = epochMillis;
  }

  @Override
  public long getNanoTicks() {
    return currentTicks;
  }

  @Override
  public long getCurrentTimeMillis() {
    return epochMillisAtZero + NANOSECONDS.toMillis(currentTicks);
  }
}
