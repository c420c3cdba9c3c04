package lumen.trace.core;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import lumen.trace.api.Config;
import lumen.trace.api.RatelimitedLogger;
import lumen.trace.api.SqlRecordMode;
import lumen.trace.api.time.TimeSource;
import lumen.trace.common.metrics.MetricKey;
import lumen.trace.common.metrics.MetricStats;
import lumen.trace.common.metrics.MetricTable;
import lumen.trace.common.sampling.SamplingDecision;
import lumen.trace.core.propagation.CarrierSetter;
import lumen.trace.core.propagation.Carriers;
import lumen.trace.core.propagation.CatAppData;
import lumen.trace.core.propagation.CatContext;
import lumen.trace.core.propagation.CatHttpCodec;
import lumen.trace.core.propagation.TraceContext;
import lumen.trace.core.util.StackTraces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * One unit of work. Spans live in an arena indexed by position; index 0 is a synthetic root that
 * spans the whole transaction. Open spans are tracked on a {@link SpanStack}, whose capacity is
 * the depth cap.
 *
 * <p>A transaction is owned by a single execution context and is not thread-safe. Work done on
 * other threads reports back through {@link #mergeMetrics(MetricTable)}.
 *
 * <p>None of the instrumentation-facing methods throw unless {@code trace.strict.mode} is on.
 */
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Transactions keep a reference to the tracer that created them")
public final class Transaction {
  private static final Logger log = LoggerFactory.getLogger(Transaction.class);

  static final int ROOT_INDEX = 0;
  private static final String UNNAMED_SPAN = "unknown";
  private static final int MAX_EXPLAIN_PLANS = 10;

  // frames trimmed from the head of captured stacks
  private static final Set<String> TRACER_CLASSES =
      Collections.unmodifiableSet(
          new HashSet<>(
              Arrays.asList(
                  Transaction.class.getName(),
                  Tracer.class.getName(),
                  SourceCodeContext.class.getName())));

  public enum State {
    PENDING,
    ACTIVE,
    FINALIZING,
    FINALIZED
  }

  private final Tracer tracer;
  private final Config config;
  private final TimeSource timeSource;
  private final RatelimitedLogger rlLog;

  private final String guid;
  private final String traceId;
  private final String rootSpanId;
  private final TraceContext parentContext;
  private final boolean sampled;
  private final float priority;
  private final long startTimeMillis;
  private final long startNanos;

  private String name;
  private boolean web;
  private State state = State.PENDING;

  private final List<Span> spans = new ArrayList<>();
  private final SpanStack stack;

  private final MetricTable metrics = new MetricTable();
  private final MetricTable scopedMetrics = new MetricTable();
  // keyed by prefix; the allWeb/allOther suffix is only known once the transaction ends
  private final MetricTable webRollups = new MetricTable();

  private final List<ErrorRecord> errors = new ArrayList<>();
  private Throwable lastNoticed;

  private int depthLimitDrops;
  private int spanLimitDrops;

  private TransactionRecord record;
  private boolean submitted;

  Transaction(
      Tracer tracer, String name, boolean web, TraceContext parent, SamplingDecision decision) {
    this.tracer = tracer;
    this.config = tracer.config();
    this.timeSource = tracer.timeSource();
    this.rlLog = tracer.rateLimitedLog();
    this.guid = tracer.idGenerationStrategy().generateGuid();
    this.parentContext = parent;
    this.traceId =
        parent != null && parent.hasTraceId()
            ? parent.getTraceId()
            : tracer.idGenerationStrategy().generateTraceId();
    this.rootSpanId = tracer.idGenerationStrategy().generateSpanId();
    this.sampled = decision.isSampled();
    this.priority = decision.getPriority();
    this.startNanos = timeSource.getNanoTicks();
    this.startTimeMillis = timeSource.getCurrentTimeMillis();
    this.name = name == null ? MetricNames.UNKNOWN : name;
    this.web = web;
    this.stack = new SpanStack(config.getTraceMaxDepth());
  }

  /**
   * Opens a span under the innermost open span, or under the root when none is open.
   *
   * @return the span's handle, or {@link SpanHandle#NOOP} when the depth or span cap is reached or
   *     the transaction has already ended
   */
  public SpanHandle openSpan(SpanKind kind, String name, Map<String, ?> attributes) {
    if (state == State.FINALIZING || state == State.FINALIZED) {
      tracer.orphanedSpan();
      misuse("Span {} opened after transaction {} ended", name, guid);
      return SpanHandle.NOOP;
    }
    try {
      activate();
      if (spans.size() - 1 >= config.getTraceMaxSpans()) {
        spanLimitDrops++;
        return SpanHandle.NOOP;
      }
      int parentIndex = stack.isEmpty() ? ROOT_INDEX : stack.top();
      int index = spans.size();
      if (!stack.push(index)) {
        depthLimitDrops++;
        return SpanHandle.NOOP;
      }
      Span span =
          new Span(
              index,
              parentIndex,
              kind == null ? SpanKind.FUNCTION : kind,
              name == null ? UNNAMED_SPAN : name,
              tracer.idGenerationStrategy().generateSpanId(),
              timeSource.getNanoTicks());
      spans.add(span);
      spans.get(parentIndex).addChild(index);
      if (config.isTraceSourceCodeContextEnabled()) {
        SourceCodeContext.apply(span, TRACER_CLASSES);
      }
      if (attributes != null) {
        for (Map.Entry<String, ?> attribute : attributes.entrySet()) {
          setAttribute(span, attribute.getKey(), attribute.getValue());
        }
      }
      return new SpanHandle(this, index, span.spanId);
    } catch (RuntimeException e) {
      rlLog.warn("Failed to open span {} on transaction {}: {}", name, guid, e.toString());
      return SpanHandle.NOOP;
    }
  }

  public SpanHandle openSpan(SpanKind kind, String name) {
    return openSpan(kind, name, null);
  }

  /**
   * Closes the span behind {@code handle}. Spans opened after it and still open are closed first,
   * at the same timestamp. Closing {@link SpanHandle#NOOP}, a foreign handle or an already closed
   * span does nothing.
   */
  public void closeSpan(SpanHandle handle, Throwable error) {
    if (handle == null || handle.isNoop()) {
      return;
    }
    if (handle.owner != this) {
      misuse("Handle {} does not belong to transaction {}", handle, guid);
      return;
    }
    if (state != State.ACTIVE) {
      return;
    }
    try {
      int position = stack.indexOf(handle.index);
      if (position < 0) {
        return;
      }
      long now = timeSource.getNanoTicks();
      while (stack.size() > position + 1) {
        closeTop(now, null);
      }
      closeTop(now, error);
    } catch (RuntimeException e) {
      rlLog.warn("Failed to close span {} on transaction {}: {}", handle, guid, e.toString());
    }
  }

  public void closeSpan(SpanHandle handle) {
    closeSpan(handle, null);
  }

  /**
   * Runs {@code work} inside a span. An exception thrown by {@code work} is recorded on the span
   * and rethrown unchanged.
   */
  public <T> T trace(SpanKind kind, String name, Map<String, ?> attributes, Callable<T> work)
      throws Exception {
    SpanHandle handle = openSpan(kind, name, attributes);
    T result;
    try {
      result = work.call();
    } catch (Exception | Error e) {
      closeSpan(handle, e);
      throw e;
    }
    closeSpan(handle, null);
    return result;
  }

  /** Sets an attribute on a span that is still open. */
  public void addSpanAttribute(SpanHandle handle, String key, Object value) {
    if (!owns(handle) || state != State.ACTIVE) {
      return;
    }
    try {
      setAttribute(spans.get(handle.index), key, value);
    } catch (RuntimeException e) {
      rlLog.warn("Failed to set attribute {} on span {}: {}", key, handle, e.toString());
    }
  }

  public void setName(String name) {
    if (name == null || hasEnded()) {
      return;
    }
    this.name = name;
  }

  public void setWeb(boolean web) {
    if (!hasEnded()) {
      this.web = web;
    }
  }

  /**
   * Records an error against the transaction. The same exception noticed again, as happens while
   * it unwinds through nested spans, is recorded once.
   */
  public void noticeError(Throwable error) {
    noticeError(error, null);
  }

  /** Folds metrics recorded by work running outside this transaction's execution context. */
  public void mergeMetrics(MetricTable other) {
    if (other == null) {
      return;
    }
    if (hasEnded()) {
      misuse("Metrics merged after transaction {} ended", guid);
      return;
    }
    metrics.merge(other);
  }

  /** The innermost open span, or the root when no span is open. */
  public String currentSpanId() {
    return stack.isEmpty() ? rootSpanId : spans.get(stack.top()).spanId;
  }

  /** Headers identifying the innermost open span, for an outbound request. */
  public Map<String, String> outboundHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    injectHeaders(headers, Carriers.MAP_SETTER);
    return headers;
  }

  public <C> void injectHeaders(C carrier, CarrierSetter<C> setter) {
    try {
      tracer.injector().inject(outboundContext(), carrier, setter);
    } catch (RuntimeException e) {
      rlLog.warn("Failed to inject headers for transaction {}: {}", guid, e.toString());
    }
  }

  /**
   * Reads the legacy app data a called application sent back and attaches it to the external
   * span, which renames the span's metrics to {@code ExternalTransaction/...}.
   */
  public void acceptResponseHeaders(SpanHandle handle, Map<String, String> headers) {
    if (headers == null || !owns(handle) || !config.isCrossApplicationTracerEnabled()) {
      return;
    }
    String header = null;
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (CatHttpCodec.APP_DATA_KEY.equalsIgnoreCase(entry.getKey())) {
        header = entry.getValue();
        break;
      }
    }
    CatAppData appData =
        CatHttpCodec.decodeAppData(
            header, config.getEncodingKey(), config.getTrustedAccountIds());
    if (appData == null) {
      return;
    }
    addSpanAttribute(handle, SpanAttributes.CAT_CROSS_PROCESS_ID, appData.getCrossProcessId());
    addSpanAttribute(handle, SpanAttributes.CAT_TRANSACTION_NAME, appData.getTransactionName());
    addSpanAttribute(handle, SpanAttributes.CAT_TRANSACTION_GUID, appData.getTransactionGuid());
  }

  /**
   * The app data header to send back to a caller that identified itself with legacy headers.
   * Empty when the caller did not or when this application has no cross process id.
   */
  public Map<String, String> responseHeaders(long contentLength) {
    CatContext inbound = parentContext == null ? null : parentContext.getCatContext();
    if (inbound == null
        || !config.isCrossApplicationTracerEnabled()
        || config.getCrossProcessId() == null
        || config.getEncodingKey() == null) {
      return Collections.emptyMap();
    }
    float responseSeconds = (timeSource.getNanoTicks() - startNanos) / 1_000_000_000f;
    CatAppData appData =
        new CatAppData(
            config.getCrossProcessId(),
            getMetricName(),
            0f,
            responseSeconds,
            contentLength,
            guid,
            false);
    return Collections.singletonMap(
        CatHttpCodec.APP_DATA_KEY, CatHttpCodec.encodeAppData(appData, config.getEncodingKey()));
  }

  /**
   * Ends the transaction: closes every open span, records transaction metrics, prunes fast spans
   * and attaches explain plans. Later calls return the same record.
   */
  public TransactionRecord finalizeTransaction() {
    if (state == State.FINALIZED || state == State.FINALIZING) {
      return record;
    }
    activate();
    state = State.FINALIZING;
    try {
      record = buildRecord();
    } catch (RuntimeException e) {
      rlLog.warn("Failed to finalize transaction {}: {}", guid, e.toString());
      record = bareRecord();
    }
    state = State.FINALIZED;
    tracer.runInterceptors(record);
    return record;
  }

  private TransactionRecord buildRecord() {
    long now = timeSource.getNanoTicks();
    while (!stack.isEmpty()) {
      closeTop(now, null);
    }
    Span root = spans.get(ROOT_INDEX);
    long duration = root.close(now);
    String metricName = getMetricName();
    root.setMetricName(metricName);
    recordTransactionMetrics(root, duration, metricName);

    boolean[] retained = retainedSpans();
    attachExplainPlans(retained);

    MetricTable recorded = metrics.copy();
    recorded.merge(scopedMetrics.rescope(metricName));
    return newRecord(toSpanRecord(ROOT_INDEX, retained), recorded, duration);
  }

  // the root alone with no metrics, used when building the full record failed
  private TransactionRecord bareRecord() {
    Span root = spans.get(ROOT_INDEX);
    if (!root.isClosed()) {
      root.close(timeSource.getNanoTicks());
    }
    SpanRecord rootRecord =
        new SpanRecord(root, name, startNanos, Collections.<SpanRecord>emptyList());
    return newRecord(rootRecord, new MetricTable(), root.getDurationNanos());
  }

  private TransactionRecord newRecord(SpanRecord root, MetricTable recorded, long duration) {
    return new TransactionRecord(
        guid,
        name,
        getMetricName(),
        web,
        startTimeMillis,
        duration,
        root,
        recorded,
        sampled,
        priority,
        traceId,
        parentContext != null && parentContext.hasTraceId() ? parentContext.getSpanId() : null,
        new ArrayList<>(errors),
        depthLimitDrops + spanLimitDrops);
  }

  private void recordTransactionMetrics(Span root, long duration, String metricName) {
    long exclusive = root.getExclusiveNanos();
    metrics.record(metricName, duration, exclusive);
    metrics.record(
        web ? MetricNames.WEB_TRANSACTION : MetricNames.OTHER_TRANSACTION_ALL, duration, exclusive);

    long totalTime = 0;
    for (Span span : spans) {
      totalTime += span.getExclusiveNanos();
    }
    metrics.record(
        web ? MetricNames.WEB_TRANSACTION_TOTAL_TIME : MetricNames.OTHER_TRANSACTION_TOTAL_TIME,
        totalTime,
        totalTime);
    metrics.record(MetricNames.totalTimeMetricName(name, web), totalTime, totalTime);

    String suffix = MetricNames.webSuffix(web);
    for (Map.Entry<MetricKey, MetricStats> rollup : webRollups.entries().entrySet()) {
      metrics.merge(rollup.getKey().getName() + suffix, rollup.getValue());
    }

    if (!errors.isEmpty()) {
      metrics.increment(MetricNames.ERRORS_ALL, errors.size());
      metrics.increment(
          web ? MetricNames.ERRORS_ALL_WEB : MetricNames.ERRORS_ALL_OTHER, errors.size());
      metrics.increment(MetricNames.errorsMetricName(metricName), errors.size());
    }
    if (depthLimitDrops > 0) {
      metrics.increment(MetricNames.DEPTH_LIMIT_EXCEEDED, depthLimitDrops);
    }
    if (spanLimitDrops > 0) {
      metrics.increment(MetricNames.SPAN_LIMIT_EXCEEDED, spanLimitDrops);
    }
  }

  /**
   * Spans at or over the segment threshold are kept, as are their ancestors. Children always sit
   * after their parent in the arena, so one reverse pass settles every span.
   */
  private boolean[] retainedSpans() {
    long threshold = config.getTraceSegmentThresholdNanos();
    boolean[] retained = new boolean[spans.size()];
    retained[ROOT_INDEX] = true;
    for (int i = spans.size() - 1; i > ROOT_INDEX; i--) {
      Span span = spans.get(i);
      if (retained[i] || span.getDurationNanos() >= threshold) {
        retained[i] = true;
        retained[span.parentIndex] = true;
      }
    }
    return retained;
  }

  private void attachExplainPlans(boolean[] retained) {
    ExplainPlanner planner = tracer.explainPlanner();
    if (planner == null) {
      return;
    }
    int attempts = 0;
    for (int i = ROOT_INDEX + 1; i < spans.size() && attempts < MAX_EXPLAIN_PLANS; i++) {
      Span span = spans.get(i);
      if (!retained[i] || !span.isExplainRequested()) {
        continue;
      }
      attempts++;
      ExplainPlanRequest request =
          new ExplainPlanRequest(
              span.spanId,
              span.getStringAttribute(SpanAttributes.DB_SYSTEM),
              statementOf(span),
              span.getAttributes());
      span.setExplainPlan(planner.explain(request));
    }
  }

  private SpanRecord toSpanRecord(int index, boolean[] retained) {
    Span span = spans.get(index);
    List<SpanRecord> children = new ArrayList<>(span.childCount());
    for (int i = 0; i < span.childCount(); i++) {
      int child = span.childAt(i);
      if (retained[child]) {
        children.add(toSpanRecord(child, retained));
      }
    }
    return new SpanRecord(span, index == ROOT_INDEX ? name : span.name, startNanos, children);
  }

  private void closeTop(long now, Throwable error) {
    Span span = spans.get(stack.pop());
    if (span.kind.isDatabase()) {
      DatastoreAttributes.apply(span, config);
    }
    long inclusive = span.close(now);
    spans.get(span.parentIndex).addChildDuration(inclusive);
    if (error != null) {
      span.setError(error);
      noticeError(error, span.spanId);
    }

    MetricNames.SpanMetrics names =
        MetricNames.forSpan(span, config.isDatastoreInstanceReportingEnabled());
    span.setMetricName(names.scoped);
    long exclusive = span.getExclusiveNanos();
    scopedMetrics.record(names.scoped, inclusive, exclusive);
    metrics.record(names.scoped, inclusive, exclusive);
    for (String rollup : names.rollups) {
      metrics.record(rollup, inclusive, exclusive);
    }
    for (String prefix : names.webRollupPrefixes) {
      webRollups.record(prefix, inclusive, exclusive);
    }

    EnrichmentPolicy enrichment = tracer.enrichmentPolicy();
    if (enrichment.shouldCaptureStackTrace(inclusive)) {
      span.setStackTrace(
          StackTraces.capture(TRACER_CLASSES, config.getTraceStackTraceMaxFrames()));
    }
    if (enrichment.shouldRequestExplain(span.kind, statementOf(span), inclusive)) {
      span.requestExplain();
    }
  }

  private void noticeError(Throwable error, String spanId) {
    if (error == null || hasEnded() || error == lastNoticed) {
      return;
    }
    lastNoticed = error;
    if (errors.size() >= config.getErrorCollectorMax()
        || config.getErrorCollectorIgnoreClasses().contains(error.getClass().getName())) {
      return;
    }
    errors.add(
        new ErrorRecord(
            timeSource.getCurrentTimeMillis(),
            error.getClass().getName(),
            error.getMessage(),
            spanId,
            StackTraces.forThrowable(error, config.getTraceStackTraceMaxFrames())));
  }

  private void setAttribute(Span span, String key, Object value) {
    if (!SpanAttributes.DB_STATEMENT.equals(key) || value == null) {
      span.setAttribute(key, value);
      return;
    }
    String sql = String.valueOf(value);
    span.setRawSql(sql);
    SqlRecordMode mode = config.getTraceSqlRecordMode();
    switch (mode) {
      case RAW:
        span.setAttribute(key, sql);
        break;
      case OFF:
        span.setAttribute(key, null);
        break;
      case OBFUSCATED:
      default:
        span.setAttribute(key, SqlStatements.obfuscate(sql));
        break;
    }
  }

  private static String statementOf(Span span) {
    return span.getRawSql() != null ? span.getRawSql() : span.name;
  }

  private void activate() {
    if (state == State.PENDING) {
      spans.add(
          new Span(
              ROOT_INDEX, Span.NO_PARENT, SpanKind.FUNCTION, name, rootSpanId, startNanos));
      state = State.ACTIVE;
    }
  }

  private TraceContext outboundContext() {
    TraceContext.Builder builder =
        TraceContext.builder()
            .traceId(traceId)
            .spanId(currentSpanId())
            .transactionId(guid)
            .sampled(sampled)
            .priority(priority)
            .parentType(TraceContext.PARENT_TYPE_APP)
            .accountId(config.getAccountId())
            .appId(config.getPrimaryApplicationId())
            .trustKey(config.getTrustedAccountKey())
            .timestampMillis(timeSource.getCurrentTimeMillis());
    if (parentContext != null) {
      builder.vendorState(parentContext.getVendorState());
    }
    if (config.getCrossProcessId() != null) {
      CatContext inbound = parentContext == null ? null : parentContext.getCatContext();
      String tripId =
          inbound != null && inbound.getTripId() != null ? inbound.getTripId() : guid;
      String pathHash =
          CatHttpCodec.pathHash(
              config.getAppName(),
              getMetricName(),
              inbound == null ? null : inbound.getPathHash());
      builder.catContext(
          new CatContext(config.getCrossProcessId(), guid, false, tripId, pathHash));
    }
    return builder.build();
  }

  private boolean owns(SpanHandle handle) {
    return handle != null
        && handle.owner == this
        && handle.index > ROOT_INDEX
        && handle.index < spans.size();
  }

  private boolean hasEnded() {
    return state == State.FINALIZING || state == State.FINALIZED;
  }

  private void misuse(String format, Object... arguments) {
    if (config.isTraceStrictMode()) {
      throw new IllegalStateException(
          MessageFormatter.arrayFormat(format, arguments).getMessage());
    }
    log.debug(format, arguments);
  }

  /** True the first time it is called; the tracer submits each record once. */
  boolean markSubmitted() {
    if (submitted) {
      return false;
    }
    submitted = true;
    return true;
  }

  public State getState() {
    return state;
  }

  public String getGuid() {
    return guid;
  }

  public String getTraceId() {
    return traceId;
  }

  public String getName() {
    return name;
  }

  public boolean isWeb() {
    return web;
  }

  public String getMetricName() {
    return MetricNames.transactionMetricName(name, web);
  }

  public boolean isSampled() {
    return sampled;
  }

  public float getPriority() {
    return priority;
  }

  /** The decoded inbound context, or {@code null} when this transaction started a trace. */
  public TraceContext getParentContext() {
    return parentContext;
  }

  /** Time between the caller creating its payload and this transaction starting, or -1. */
  public long getTransportDurationMillis() {
    if (parentContext == null || parentContext.getTimestampMillis() <= 0) {
      return -1;
    }
    return Math.max(0, startTimeMillis - parentContext.getTimestampMillis());
  }

  @Override
  public String toString() {
    return "Transaction{guid=" + guid + ", name=" + name + ", state=" + state + '}';
  }
}
