package lumen.trace.common.metrics;

import static java.util.concurrent.TimeUnit.SECONDS;
import static lumen.trace.common.metrics.SignalItem.ReportSignal.REPORT;
import static lumen.trace.common.metrics.SignalItem.StopSignal.STOP;
import static lumen.trace.util.AgentThreadFactory.AgentThread.METRICS_AGGREGATOR;
import static lumen.trace.util.AgentThreadFactory.AgentThread.METRICS_REPORTER;
import static lumen.trace.util.AgentThreadFactory.THREAD_JOIN_TIMOUT_MS;
import static lumen.trace.util.AgentThreadFactory.newAgentThread;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lumen.trace.api.Config;
import lumen.trace.api.time.SystemTimeSource;
import lumen.trace.api.time.TimeSource;
import lumen.trace.common.metrics.SignalItem.ReportSignal;
import lumen.trace.core.TransactionRecord;
import lumen.trace.util.AgentThreadFactory;
import org.jctools.queues.MessagePassingQueue;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the metric tables of finalized transactions into process-wide rollups. Submitters only
 * enqueue; a single aggregator thread owns the rollup table and flushes it to the {@link
 * MetricWriter} every reporting interval.
 */
public final class RollupMetricsAggregator implements MetricsAggregator {

  private static final Logger log = LoggerFactory.getLogger(RollupMetricsAggregator.class);

  private static final int INBOX_CHUNK_SIZE = 1024;

  private final MessagePassingQueue<InboxItem> inbox;
  private final Thread thread;
  private final Aggregator aggregator;
  private final long reportingInterval;
  private final TimeUnit reportingIntervalTimeUnit;

  private volatile ScheduledExecutorService reporter;
  private volatile boolean stopped;

  public RollupMetricsAggregator(Config config, MetricWriter writer) {
    this(
        writer,
        SystemTimeSource.INSTANCE,
        config.getMetricsReportingIntervalSeconds(),
        SECONDS);
  }

  RollupMetricsAggregator(
      MetricWriter writer,
      TimeSource timeSource,
      long reportingInterval,
      TimeUnit reportingIntervalTimeUnit) {
    this.inbox = new MpscUnboundedArrayQueue<>(INBOX_CHUNK_SIZE);
    this.reportingInterval = reportingInterval;
    this.reportingIntervalTimeUnit = reportingIntervalTimeUnit;
    this.aggregator =
        new Aggregator(writer, inbox, timeSource, reportingInterval, reportingIntervalTimeUnit);
    this.thread = newAgentThread(METRICS_AGGREGATOR, aggregator);
  }

  @Override
  public void start() {
    thread.start();
    reporter = Executors.newSingleThreadScheduledExecutor(new AgentThreadFactory(METRICS_REPORTER));
    reporter.scheduleAtFixedRate(
        this::report, reportingInterval, reportingInterval, reportingIntervalTimeUnit);
    log.debug("started metrics aggregator");
  }

  @Override
  public boolean report() {
    boolean published = inbox.offer(REPORT);
    if (!published) {
      log.debug("Skipped metrics reporting because the queue is full");
    }
    return published;
  }

  @Override
  public Future<Boolean> forceReport() {
    if (!thread.isAlive()) {
      return CompletableFuture.completedFuture(false);
    }
    ReportSignal reportSignal = new ReportSignal();
    if (inbox.offer(reportSignal)) {
      return reportSignal.future;
    }
    return CompletableFuture.completedFuture(false);
  }

  @Override
  public void submit(TransactionRecord record) {
    if (record == null || stopped) {
      return;
    }
    // getMetrics() hands out a copy owned by the aggregator thread from here on
    inbox.offer(new MetricsItem(record.getMetrics()));
  }

  @Override
  public void submit(MetricTable metrics) {
    if (metrics != null && !metrics.isEmpty() && !stopped) {
      inbox.offer(new MetricsItem(metrics));
    }
  }

  /** Items waiting for the aggregator thread. */
  int queuedItems() {
    return inbox.size();
  }

  public void stop() {
    stopped = true;
    ScheduledExecutorService scheduled = reporter;
    if (null != scheduled) {
      scheduled.shutdownNow();
    }
    inbox.offer(STOP);
  }

  @Override
  public void close() {
    stop();
    try {
      thread.join(THREAD_JOIN_TIMOUT_MS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }
}
