package lumen.trace.common.metrics;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import lumen.trace.api.time.TimeSource;
import lumen.trace.common.metrics.SignalItem.StopSignal;
import org.jctools.queues.MessagePassingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Single writer of the rollup table: drains the inbox and reports on signals. */
final class Aggregator implements Runnable {

  private static final long DEFAULT_SLEEP_MILLIS = 10;

  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private final MessagePassingQueue<InboxItem> inbox;
  private final MetricTable aggregates = new MetricTable();
  private final MetricWriter writer;
  private final TimeSource timeSource;
  private final long reportingIntervalNanos;

  private final long sleepMillis;

  private boolean dirty;
  private long bucketStartMillis;

  Aggregator(
      MetricWriter writer,
      MessagePassingQueue<InboxItem> inbox,
      TimeSource timeSource,
      long reportingInterval,
      TimeUnit reportingIntervalTimeUnit) {
    this(
        writer,
        inbox,
        timeSource,
        reportingInterval,
        reportingIntervalTimeUnit,
        DEFAULT_SLEEP_MILLIS);
  }

  Aggregator(
      MetricWriter writer,
      MessagePassingQueue<InboxItem> inbox,
      TimeSource timeSource,
      long reportingInterval,
      TimeUnit reportingIntervalTimeUnit,
      long sleepMillis) {
    this.writer = writer;
    this.inbox = inbox;
    this.timeSource = timeSource;
    this.reportingIntervalNanos = reportingIntervalTimeUnit.toNanos(reportingInterval);
    this.sleepMillis = sleepMillis;
    this.bucketStartMillis = timeSource.getCurrentTimeMillis();
  }

  @Override
  public void run() {
    Thread currentThread = Thread.currentThread();
    Drainer drainer = new Drainer();
    while (!currentThread.isInterrupted() && !drainer.stopped) {
      try {
        if (!inbox.isEmpty()) {
          inbox.drain(drainer);
        } else {
          Thread.sleep(sleepMillis);
        }
      } catch (InterruptedException e) {
        currentThread.interrupt();
      } catch (Throwable error) {
        log.debug("error aggregating metrics", error);
      }
    }
    log.debug("metrics aggregator exited");
  }

  private final class Drainer implements MessagePassingQueue.Consumer<InboxItem> {

    boolean stopped = false;

    @Override
    public void accept(InboxItem item) {
      if (item instanceof SignalItem) {
        SignalItem signal = (SignalItem) item;
        if (!stopped) {
          report(signal);
          stopped = item instanceof StopSignal;
        } else {
          signal.ignore();
        }
      } else if (item instanceof MetricsItem && !stopped) {
        aggregates.merge(((MetricsItem) item).metrics);
        dirty = true;
      }
    }
  }

  private void report(SignalItem signal) {
    boolean skipped = true;
    long now = timeSource.getCurrentTimeMillis();
    if (dirty) {
      try {
        if (!aggregates.isEmpty()) {
          skipped = false;
          writer.startBucket(
              aggregates.size(), MILLISECONDS.toNanos(bucketStartMillis), reportingIntervalNanos);
          for (Map.Entry<MetricKey, MetricStats> aggregate : aggregates.entries().entrySet()) {
            writer.add(aggregate.getKey(), aggregate.getValue());
          }
          // note that this may do IO and block
          writer.finishBucket();
        }
      } catch (Throwable error) {
        writer.reset();
        log.debug("Error publishing metrics. Dropping payload", error);
      }
      aggregates.clear();
      dirty = false;
    }
    bucketStartMillis = now;
    signal.complete();
    if (skipped) {
      log.debug("skipped metrics reporting because no points have changed");
    }
  }
}
