package lumen.trace.core;

import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lumen.trace.api.Config;
import lumen.trace.api.IdGenerationStrategy;
import lumen.trace.api.RatelimitedLogger;
import lumen.trace.api.time.SystemTimeSource;
import lumen.trace.api.time.TimeSource;
import lumen.trace.common.metrics.LoggingMetricWriter;
import lumen.trace.common.metrics.MetricTable;
import lumen.trace.common.metrics.MetricsAggregator;
import lumen.trace.common.metrics.RollupMetricsAggregator;
import lumen.trace.common.sampling.AdaptiveSampler;
import lumen.trace.common.sampling.Sampler;
import lumen.trace.common.sampling.SamplingDecision;
import lumen.trace.core.propagation.CarrierVisitor;
import lumen.trace.core.propagation.Carriers;
import lumen.trace.core.propagation.HttpCodec;
import lumen.trace.core.propagation.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for instrumentation. Starts transactions, optionally joining an inbound trace, and
 * hands finalized records to the interceptors and the metrics aggregator.
 *
 * <p>A tracer is safe to share between threads; the transactions it creates are not.
 */
public class Tracer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Tracer.class);

  private final Config config;
  private final TimeSource timeSource;
  private final IdGenerationStrategy idGenerationStrategy;
  private final Sampler sampler;
  private final MetricsAggregator metricsAggregator;
  private final HttpCodec.Injector injector;
  private final HttpCodec.Extractor extractor;
  private final EnrichmentPolicy enrichmentPolicy;
  private final ExplainPlanner explainPlanner;
  private final List<TraceInterceptor> interceptors;
  private final RatelimitedLogger rlLog;

  private Tracer(Builder builder) {
    this.config = builder.config != null ? builder.config : Config.get();
    this.timeSource = builder.timeSource;
    this.idGenerationStrategy =
        builder.idGenerationStrategy != null
            ? builder.idGenerationStrategy
            : IdGenerationStrategy.fromName("RANDOM");
    this.sampler =
        builder.sampler != null
            ? builder.sampler
            : new AdaptiveSampler(
                config.getSamplingTarget(),
                config.getSamplingIntervalSeconds(),
                SECONDS,
                timeSource);
    this.metricsAggregator =
        builder.metricsAggregator != null
            ? builder.metricsAggregator
            : new RollupMetricsAggregator(config, new LoggingMetricWriter());
    this.injector =
        builder.injector != null ? builder.injector : HttpCodec.createInjector(config);
    this.extractor =
        builder.extractor != null ? builder.extractor : HttpCodec.createExtractor(config);
    this.enrichmentPolicy = new EnrichmentPolicy(config);
    this.explainPlanner =
        builder.explainPlanProvider != null && config.isTraceExplainEnabled()
            ? new ExplainPlanner(builder.explainPlanProvider, config.getTraceExplainTimeoutMillis())
            : null;
    List<TraceInterceptor> sorted = new ArrayList<>(builder.interceptors);
    sorted.sort(Comparator.comparingInt(TraceInterceptor::priority));
    this.interceptors = Collections.unmodifiableList(sorted);
    this.rlLog = new RatelimitedLogger(log, 5, MINUTES);

    metricsAggregator.start();
    log.debug("Tracer started for {} with {}", config.getAppName(), config);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts a transaction that begins a new trace. */
  public Transaction beginUnitOfWork(String name, boolean web) {
    return beginUnitOfWork(name, web, null, null);
  }

  /** Starts a transaction, joining the trace described by inbound {@code headers} if any. */
  public Transaction beginUnitOfWork(String name, boolean web, Map<String, String> headers) {
    return beginUnitOfWork(name, web, headers, Carriers.MAP_VISITOR);
  }

  public <C> Transaction beginUnitOfWork(
      String name, boolean web, C carrier, CarrierVisitor<C> visitor) {
    TraceContext parent = null;
    String acceptMetric = null;
    if (carrier != null && visitor != null) {
      try {
        parent = extractor.extract(carrier, visitor);
        if (config.isDistributedTracingEnabled()) {
          acceptMetric = acceptPayloadMetric(parent, carrier, visitor);
        }
      } catch (RuntimeException e) {
        rlLog.warn("Failed to read inbound trace context for {}: {}", name, e.toString());
        parent = null;
      }
    }
    Transaction transaction;
    try {
      transaction = new Transaction(this, name, web, parent, samplingDecision(parent));
    } catch (RuntimeException e) {
      rlLog.warn("Failed to start transaction {} from {}: {}", name, parent, e.toString());
      transaction = new Transaction(this, name, web, null, new SamplingDecision(false, 0f));
      acceptMetric = null;
    }
    if (acceptMetric != null) {
      MetricTable supportability = new MetricTable();
      supportability.increment(acceptMetric);
      transaction.mergeMetrics(supportability);
    }
    return transaction;
  }

  /**
   * Finalizes {@code transaction} and submits its record for aggregation. Safe to call more than
   * once; the record is submitted the first time only.
   */
  public TransactionRecord endUnitOfWork(Transaction transaction) {
    if (transaction == null) {
      return null;
    }
    TransactionRecord record = transaction.finalizeTransaction();
    if (record != null && transaction.markSubmitted()) {
      try {
        metricsAggregator.submit(record);
      } catch (RuntimeException e) {
        rlLog.warn("Failed to submit transaction {}: {}", record.getGuid(), e.toString());
      }
    }
    return record;
  }

  /** Flushes pending metrics and stops background threads. */
  @Override
  public void close() {
    if (explainPlanner != null) {
      explainPlanner.close();
    }
    metricsAggregator.close();
  }

  private <C> String acceptPayloadMetric(
      TraceContext parent, C carrier, CarrierVisitor<C> visitor) {
    if (parent != null && parent.hasTraceId()) {
      return MetricNames.ACCEPT_PAYLOAD_SUCCESS;
    }
    return extractor.hasPayload(carrier, visitor)
        ? MetricNames.ACCEPT_PAYLOAD_PARSE_EXCEPTION
        : MetricNames.ACCEPT_PAYLOAD_IGNORED_NULL;
  }

  /**
   * An upstream decision is honoured; a priority is generated when the caller sent only the
   * sampled flag.
   */
  private SamplingDecision samplingDecision(TraceContext parent) {
    if (parent != null && parent.hasTraceId() && parent.getSampled() != null) {
      boolean sampled = parent.getSampled();
      return parent.getPriority() != null
          ? new SamplingDecision(sampled, parent.getPriority())
          : SamplingDecision.of(sampled);
    }
    return sampler.decide();
  }

  void runInterceptors(TransactionRecord record) {
    for (TraceInterceptor interceptor : interceptors) {
      try {
        interceptor.onTransactionFinalized(record);
      } catch (Throwable e) {
        rlLog.warn(
            "Interceptor {} failed on transaction {}: {}",
            interceptor.getClass().getName(),
            record.getGuid(),
            e.toString());
      }
    }
  }

  // late opens have no record to land in, so they go straight to the aggregator
  void orphanedSpan() {
    MetricTable orphans = new MetricTable();
    orphans.increment(MetricNames.ORPHANED_SPAN);
    try {
      metricsAggregator.submit(orphans);
    } catch (RuntimeException e) {
      log.debug("Failed to submit orphaned span count", e);
    }
  }

  Config config() {
    return config;
  }

  TimeSource timeSource() {
    return timeSource;
  }

  IdGenerationStrategy idGenerationStrategy() {
    return idGenerationStrategy;
  }

  HttpCodec.Injector injector() {
    return injector;
  }

  EnrichmentPolicy enrichmentPolicy() {
    return enrichmentPolicy;
  }

  ExplainPlanner explainPlanner() {
    return explainPlanner;
  }

  RatelimitedLogger rateLimitedLog() {
    return rlLog;
  }

  public static class Builder {
    private Config config;
    private TimeSource timeSource = SystemTimeSource.INSTANCE;
    private IdGenerationStrategy idGenerationStrategy;
    private Sampler sampler;
    private MetricsAggregator metricsAggregator;
    private HttpCodec.Injector injector;
    private HttpCodec.Extractor extractor;
    private ExplainPlanProvider explainPlanProvider;
    private final List<TraceInterceptor> interceptors = new ArrayList<>();

    Builder() {}

    public Builder config(Config config) {
      this.config = config;
      return this;
    }

    public Builder timeSource(TimeSource timeSource) {
      this.timeSource = timeSource;
      return this;
    }

    public Builder idGenerationStrategy(IdGenerationStrategy idGenerationStrategy) {
      this.idGenerationStrategy = idGenerationStrategy;
      return this;
    }

    public Builder sampler(Sampler sampler) {
      this.sampler = sampler;
      return this;
    }

    public Builder metricsAggregator(MetricsAggregator metricsAggregator) {
      this.metricsAggregator = metricsAggregator;
      return this;
    }

    public Builder injector(HttpCodec.Injector injector) {
      this.injector = injector;
      return this;
    }

    public Builder extractor(HttpCodec.Extractor extractor) {
      this.extractor = extractor;
      return this;
    }

    public Builder explainPlanProvider(ExplainPlanProvider explainPlanProvider) {
      this.explainPlanProvider = explainPlanProvider;
      return this;
    }

    public Builder interceptor(TraceInterceptor interceptor) {
      if (interceptor != null) {
        interceptors.add(interceptor);
      }
      return this;
    }

    public Tracer build() {
      return new Tracer(this);
    }
  }
}
