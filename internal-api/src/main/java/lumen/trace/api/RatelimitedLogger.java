package lumen.trace.api;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lumen.trace.api.time.SystemTimeSource;
import lumen.trace.api.time.TimeSource;
import org.slf4j.Logger;

/**
 * Logger that logs message once per given delay if debugging is disabled. If debugging is enabled
 * then it logs every time.
 */
public class RatelimitedLogger {

  private final Logger log;
  private final long delay;
  private final String noLogMessage;
  private final TimeSource timeSource;

  private final AtomicLong previousErrorLogNanos = new AtomicLong();
  private volatile boolean logged;

  public RatelimitedLogger(final Logger log, final int delay, final TimeUnit timeUnit) {
    this(log, delay, timeUnit, SystemTimeSource.INSTANCE);
  }

  // Visible for testing
  RatelimitedLogger(
      final Logger log, final int delay, final TimeUnit timeUnit, final TimeSource timeSource) {
    this.log = log;
    this.delay = timeUnit.toNanos(delay);
    this.noLogMessage = createNoLogMessage(" (Will not log errors for ", ")", delay, timeUnit);
    this.timeSource = timeSource;
  }

  /** @return true if actually logged the message, false otherwise */
  public boolean warn(final String format, final Object... arguments) {
    if (log.isDebugEnabled()) {
      log.warn(format, arguments);
      return true;
    }
    if (log.isWarnEnabled()) {
      final long previous = previousErrorLogNanos.get();
      final long now = timeSource.getNanoTicks();
      if (!logged || now - previous >= delay) {
        if (previousErrorLogNanos.compareAndSet(previous, now)) {
          logged = true;
          log.warn(format + noLogMessage, arguments);
          return true;
        }
      }
    }
    return false;
  }

  private static String createNoLogMessage(
      final String prefix, final String suffix, final int delay, final TimeUnit timeUnit) {
    StringBuilder sb = new StringBuilder(prefix).append(delay).append(' ');
    String unit = timeUnit.name().toLowerCase();
    if (delay == 1) {
      unit = unit.substring(0, unit.length() - 1);
    }
    return sb.append(unit).append(suffix).toString();
  }
}
