package lumen.trace.core;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import lumen.trace.common.metrics.MetricStats;
import lumen.trace.common.metrics.MetricTable;
import lumen.trace.common.metrics.MetricsAggregator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransactionTest {

  private static final long MS = MILLISECONDS.toNanos(1);

  @Mock ExplainPlanProvider explainPlanProvider;
  @Mock MetricsAggregator aggregator;

  private final TracerFixture fixture = new TracerFixture();
  private Tracer tracer;

  @AfterEach
  void closeTracer() {
    if (tracer != null) {
      tracer.close();
    }
  }

  private Tracer tracer() {
    tracer = fixture.build();
    return tracer;
  }

  private static Map<String, Object> statement(String sql) {
    Map<String, Object> attributes = new HashMap<>();
    attributes.put(SpanAttributes.DB_STATEMENT, sql);
    attributes.put(SpanAttributes.DB_SYSTEM, "Postgres");
    return attributes;
  }

  @Test
  @DisplayName("handler(80ms) around select(50ms)")
  void handlerAroundSelect() {
    Transaction txn = tracer().beginUnitOfWork("checkout", true);

    SpanHandle handler = txn.openSpan(SpanKind.FUNCTION, "handler");
    fixture.time.advance(10 * MS);
    SpanHandle select = txn.openSpan(SpanKind.DATABASE, "select");
    fixture.time.advance(50 * MS);
    txn.closeSpan(select);
    fixture.time.advance(20 * MS);
    txn.closeSpan(handler);
    TransactionRecord record = tracer.endUnitOfWork(txn);

    SpanRecord handlerRecord = record.getRoot().find("handler");
    assertEquals(80 * MS, handlerRecord.getDurationNanos());
    assertEquals(30 * MS, handlerRecord.getExclusiveNanos());
    assertEquals("Function/handler", handlerRecord.getMetricName());

    SpanRecord selectRecord = handlerRecord.find("select");
    assertEquals(50 * MS, selectRecord.getDurationNanos());
    assertEquals(50 * MS, selectRecord.getExclusiveNanos());
    assertEquals(10 * MS, selectRecord.getStartOffsetNanos());
    assertEquals("Datastore/operation/Unknown/select", selectRecord.getMetricName());

    MetricStats handlerStats = record.getMetric("Function/handler");
    assertEquals(1, handlerStats.getCallCount());
    assertEquals(80 * MS, handlerStats.getTotalNanos());
    assertEquals(30 * MS, handlerStats.getExclusiveNanos());
    assertEquals(50 * MS, record.getMetric("Datastore/operation/Unknown/select").getTotalNanos());
    assertEquals(
        50 * MS, record.getScopedMetric("Datastore/operation/Unknown/select").getTotalNanos());
  }

  @Test
  void exclusiveTimeOfNestedSpans() {
    Transaction txn = tracer().beginUnitOfWork("nested", false);

    SpanHandle a = txn.openSpan(SpanKind.FUNCTION, "a");
    fixture.time.advance(5 * MS);
    SpanHandle b = txn.openSpan(SpanKind.FUNCTION, "b");
    fixture.time.advance(5 * MS);
    SpanHandle c = txn.openSpan(SpanKind.FUNCTION, "c");
    fixture.time.advance(10 * MS);
    txn.closeSpan(c);
    SpanHandle d = txn.openSpan(SpanKind.FUNCTION, "d");
    fixture.time.advance(3 * MS);
    txn.closeSpan(d);
    txn.closeSpan(b);
    fixture.time.advance(2 * MS);
    txn.closeSpan(a);
    TransactionRecord record = txn.finalizeTransaction();

    SpanRecord recordA = record.getRoot().find("a");
    SpanRecord recordB = record.getRoot().find("b");
    assertEquals(25 * MS, recordA.getDurationNanos());
    assertEquals(7 * MS, recordA.getExclusiveNanos());
    assertEquals(18 * MS, recordB.getDurationNanos());
    assertEquals(5 * MS, recordB.getExclusiveNanos());
    assertEquals(2, recordB.getChildren().size());

    SpanRecord root = record.getRoot();
    assertEquals("nested", root.getName());
    assertEquals(25 * MS, root.getDurationNanos());
    assertEquals(0, root.getExclusiveNanos());
    assertEquals(
        25 * MS, record.getMetric(MetricNames.OTHER_TRANSACTION_TOTAL_TIME).getTotalNanos());
  }

  @Test
  void closingAnInnerSpanClosesEverythingAboveIt() {
    Transaction txn = tracer().beginUnitOfWork("unwind", false);

    SpanHandle a = txn.openSpan(SpanKind.FUNCTION, "a");
    fixture.time.advance(10 * MS);
    SpanHandle b = txn.openSpan(SpanKind.FUNCTION, "b");
    fixture.time.advance(10 * MS);
    SpanHandle c = txn.openSpan(SpanKind.FUNCTION, "c");
    fixture.time.advance(10 * MS);

    txn.closeSpan(b);
    assertEquals(a.getSpanId(), txn.currentSpanId());

    fixture.time.advance(10 * MS);
    txn.closeSpan(c);
    txn.closeSpan(a);
    TransactionRecord record = txn.finalizeTransaction();

    assertEquals(10 * MS, record.getRoot().find("c").getDurationNanos());
    assertEquals(20 * MS, record.getRoot().find("b").getDurationNanos());
    assertEquals(10 * MS, record.getRoot().find("b").getExclusiveNanos());
    assertEquals(40 * MS, record.getRoot().find("a").getDurationNanos());
    assertEquals(20 * MS, record.getRoot().find("a").getExclusiveNanos());
    assertEquals(1, record.getMetric("Function/c").getCallCount());
  }

  @Test
  void finalizeIsIdempotent() {
    tracer = fixture.aggregator(aggregator).build();
    Transaction txn = tracer.beginUnitOfWork("once", true);
    txn.openSpan(SpanKind.FUNCTION, "left-open");
    fixture.time.advance(7 * MS);

    TransactionRecord first = txn.finalizeTransaction();
    TransactionRecord second = txn.finalizeTransaction();

    assertSame(first, second);
    assertEquals(Transaction.State.FINALIZED, txn.getState());
    assertEquals(7 * MS, first.getRoot().find("left-open").getDurationNanos());
    assertEquals(1, first.getMetric("WebTransaction/once").getCallCount());
  }

  @Test
  void recordMetricsCannotBeChangedByConsumers() {
    Transaction txn = tracer().beginUnitOfWork("readonly", true);
    txn.closeSpan(txn.openSpan(SpanKind.FUNCTION, "f"));
    TransactionRecord record = txn.finalizeTransaction();
    int size = record.getMetrics().size();

    record.getMetrics().record("Injected/after/finalize", 1, 1);
    record.getMetric("Function/f").record(1, 1);
    record.getScopedMetric("Function/f").increment(5);

    TransactionRecord again = txn.finalizeTransaction();
    assertEquals(size, again.getMetrics().size());
    assertNull(again.getMetric("Injected/after/finalize"));
    assertEquals(1, again.getMetric("Function/f").getCallCount());
    assertEquals(1, again.getScopedMetric("Function/f").getCallCount());
  }

  @Test
  void recordIsSubmittedOnce() {
    tracer = fixture.aggregator(aggregator).build();
    Transaction txn = tracer.beginUnitOfWork("once", true);

    TransactionRecord first = tracer.endUnitOfWork(txn);
    TransactionRecord second = tracer.endUnitOfWork(txn);

    assertSame(first, second);
    verify(aggregator, times(1)).submit(first);
  }

  @Test
  void depthIsCappedAt300() {
    Transaction txn = tracer().beginUnitOfWork("deep", false);
    SpanHandle[] handles = new SpanHandle[300];
    for (int i = 0; i < 300; i++) {
      handles[i] = txn.openSpan(SpanKind.FUNCTION, "level" + i);
      assertFalse(handles[i].isNoop());
    }

    SpanHandle overflow = txn.openSpan(SpanKind.FUNCTION, "level300");
    assertTrue(overflow.isNoop());
    assertSame(SpanHandle.NOOP, overflow);
    txn.closeSpan(overflow);
    assertEquals(handles[299].getSpanId(), txn.currentSpanId());

    for (int i = 299; i >= 0; i--) {
      txn.closeSpan(handles[i]);
    }
    TransactionRecord record = txn.finalizeTransaction();

    int depth = 0;
    SpanRecord node = record.getRoot();
    while (!node.getChildren().isEmpty()) {
      assertEquals(1, node.getChildren().size());
      node = node.getChildren().get(0);
      depth++;
    }
    assertEquals(300, depth);
    assertEquals("level299", node.getName());
    assertEquals(1, record.getDroppedSpanCount());
    assertEquals(1, record.getMetric(MetricNames.DEPTH_LIMIT_EXCEEDED).getCallCount());
  }

  @Test
  void spanCountIsCapped() {
    fixture.set("trace.max.spans", "5");
    Transaction txn = tracer().beginUnitOfWork("wide", false);

    for (int i = 0; i < 7; i++) {
      txn.closeSpan(txn.openSpan(SpanKind.FUNCTION, "s" + i));
    }
    TransactionRecord record = txn.finalizeTransaction();

    assertEquals(5, record.getRoot().getChildren().size());
    assertEquals(2, record.getDroppedSpanCount());
    assertEquals(2, record.getMetric(MetricNames.SPAN_LIMIT_EXCEEDED).getCallCount());
    assertNull(record.getRoot().find("s5"));
  }

  @Test
  void lateOpensGoToTheOrphanSink() {
    tracer = fixture.aggregator(aggregator).build();
    Transaction txn = tracer.beginUnitOfWork("late", false);
    TransactionRecord record = tracer.endUnitOfWork(txn);

    SpanHandle late = txn.openSpan(SpanKind.FUNCTION, "late");
    txn.closeSpan(late);

    assertTrue(late.isNoop());
    assertEquals(1, record.getRoot().size());
    ArgumentCaptor<MetricTable> orphans = ArgumentCaptor.forClass(MetricTable.class);
    verify(aggregator).submit(orphans.capture());
    assertEquals(1, orphans.getValue().get(MetricNames.ORPHANED_SPAN).getCallCount());
  }

  @Test
  void strictModeRejectsLateOpens() {
    fixture.set("trace.strict.mode", "true");
    Transaction txn = tracer().beginUnitOfWork("late", false);
    txn.finalizeTransaction();

    assertThrows(IllegalStateException.class, () -> txn.openSpan(SpanKind.FUNCTION, "late"));
  }

  @Test
  void foreignHandlesAreIgnored() {
    Tracer tracer = tracer();
    Transaction first = tracer.beginUnitOfWork("first", false);
    Transaction second = tracer.beginUnitOfWork("second", false);
    SpanHandle handle = first.openSpan(SpanKind.FUNCTION, "mine");

    second.closeSpan(handle);
    second.addSpanAttribute(handle, "key", "value");

    assertEquals(handle.getSpanId(), first.currentSpanId());
    assertFalse(
        first.finalizeTransaction().getRoot().find("mine").getAttributes().containsKey("key"));
  }

  @Test
  void fastSpansArePruned() {
    fixture.set("trace.segment.threshold", "10");
    Transaction txn = tracer().beginUnitOfWork("prune", true);

    SpanHandle slow = txn.openSpan(SpanKind.FUNCTION, "slow");
    SpanHandle fast = txn.openSpan(SpanKind.FUNCTION, "fast");
    fixture.time.advance(MS);
    txn.closeSpan(fast);
    SpanHandle slowChild = txn.openSpan(SpanKind.FUNCTION, "slowChild");
    fixture.time.advance(12 * MS);
    txn.closeSpan(slowChild);
    txn.closeSpan(slow);
    txn.closeSpan(txn.openSpan(SpanKind.FUNCTION, "sibling"));
    TransactionRecord record = txn.finalizeTransaction();

    assertNotNull(record.getRoot().find("slow"));
    assertNotNull(record.getRoot().find("slowChild"));
    assertNull(record.getRoot().find("fast"));
    assertNull(record.getRoot().find("sibling"));
    assertEquals(3, record.getRoot().size());
    // pruned spans still count
    assertEquals(1, record.getMetric("Function/fast").getCallCount());
    assertEquals(1, record.getMetric("Function/sibling").getCallCount());
  }

  @Test
  @DisplayName("select gets a stack and an explain plan, drop only a stack")
  void slowNodeEnrichment() throws Exception {
    fixture
        .set("trace.explain.threshold", "0")
        .set("trace.stack.trace.threshold", "0")
        .explainPlanProvider(explainPlanProvider);
    when(explainPlanProvider.explain(any())).thenReturn("Seq Scan on users");
    Transaction txn = tracer().beginUnitOfWork("enrich", true);

    SpanHandle select =
        txn.openSpan(SpanKind.DATABASE, "query", statement("SELECT * FROM users WHERE id = 42"));
    fixture.time.advance(MS);
    txn.closeSpan(select);
    SpanHandle drop = txn.openSpan(SpanKind.DATABASE, "ddl", statement("DROP TABLE users"));
    txn.closeSpan(drop);
    TransactionRecord record = txn.finalizeTransaction();

    SpanRecord selectRecord = record.getRoot().find("query");
    assertNotNull(selectRecord.getStackTrace());
    assertTrue(selectRecord.getStackTrace().get(0).contains(TransactionTest.class.getName()));
    assertTrue(selectRecord.isExplainRequested());
    assertEquals("Seq Scan on users", selectRecord.getExplainPlan());
    assertEquals(
        "SELECT * FROM users WHERE id = ?",
        selectRecord.getAttributes().get(SpanAttributes.DB_STATEMENT));
    assertEquals("Datastore/statement/Postgres/users/select", selectRecord.getMetricName());

    SpanRecord dropRecord = record.getRoot().find("ddl");
    assertNotNull(dropRecord.getStackTrace());
    assertFalse(dropRecord.isExplainRequested());
    assertNull(dropRecord.getExplainPlan());
    assertEquals("Datastore/statement/Postgres/other/other", dropRecord.getMetricName());

    ArgumentCaptor<ExplainPlanRequest> request = ArgumentCaptor.forClass(ExplainPlanRequest.class);
    verify(explainPlanProvider, times(1)).explain(request.capture());
    assertEquals("SELECT * FROM users WHERE id = 42", request.getValue().getSql());
    assertEquals("Postgres", request.getValue().getProduct());
    assertEquals(selectRecord.getSpanId(), request.getValue().getSpanId());
  }

  @Test
  void noExplainPlanForNonSqlDatastores() throws Exception {
    fixture.set("trace.explain.threshold", "0").explainPlanProvider(explainPlanProvider);
    Transaction txn = tracer().beginUnitOfWork("cache", true);

    SpanHandle delete =
        txn.openSpan(
            SpanKind.DATASTORE,
            "delete",
            Collections.singletonMap(SpanAttributes.DB_SYSTEM, "Memcached"));
    fixture.time.advance(600 * MS);
    txn.closeSpan(delete);
    TransactionRecord record = txn.finalizeTransaction();

    assertFalse(record.getRoot().find("delete").isExplainRequested());
    verify(explainPlanProvider, never()).explain(any());
  }

  @Test
  void fastSpansAreNotEnriched() throws Exception {
    fixture.explainPlanProvider(explainPlanProvider);
    Transaction txn = tracer().beginUnitOfWork("quick", true);

    SpanHandle select = txn.openSpan(SpanKind.DATABASE, "query", statement("select 1 from t"));
    fixture.time.advance(10 * MS);
    txn.closeSpan(select);
    TransactionRecord record = txn.finalizeTransaction();

    SpanRecord selectRecord = record.getRoot().find("query");
    assertNull(selectRecord.getStackTrace());
    assertFalse(selectRecord.isExplainRequested());
    verify(explainPlanProvider, times(0)).explain(any());
  }

  @Test
  void explainPlanTimeoutLeavesThePlanEmpty() throws Exception {
    fixture
        .set("trace.explain.threshold", "0")
        .set("trace.explain.timeout", "50")
        .explainPlanProvider(explainPlanProvider);
    doAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return "too late";
            })
        .when(explainPlanProvider)
        .explain(any());
    Transaction txn = tracer().beginUnitOfWork("timeout", true);

    txn.closeSpan(txn.openSpan(SpanKind.DATABASE, "query", statement("select * from orders")));
    long started = System.nanoTime();
    TransactionRecord record = txn.finalizeTransaction();

    assertTrue(System.nanoTime() - started < MILLISECONDS.toNanos(2_000));
    assertTrue(record.getRoot().find("query").isExplainRequested());
    assertNull(record.getRoot().find("query").getExplainPlan());
  }

  @Test
  void failingExplainPlanProvider() throws Exception {
    fixture.set("trace.explain.threshold", "0").explainPlanProvider(explainPlanProvider);
    when(explainPlanProvider.explain(any())).thenThrow(new IllegalStateException("no connection"));
    Transaction txn = tracer().beginUnitOfWork("failing", true);

    txn.closeSpan(txn.openSpan(SpanKind.DATABASE, "query", statement("select * from orders")));
    TransactionRecord record = txn.finalizeTransaction();

    assertNull(record.getRoot().find("query").getExplainPlan());
  }

  @Test
  void sqlRecordModes() {
    fixture.set("trace.sql.record", "raw");
    Transaction raw = tracer().beginUnitOfWork("raw", false);
    raw.closeSpan(raw.openSpan(SpanKind.DATABASE, "q", statement("select * from t where a = 'x'")));
    assertEquals(
        "select * from t where a = 'x'",
        raw.finalizeTransaction()
            .getRoot()
            .find("q")
            .getAttributes()
            .get(SpanAttributes.DB_STATEMENT));
    tracer.close();

    fixture.set("trace.sql.record", "off");
    Transaction off = tracer().beginUnitOfWork("off", false);
    off.closeSpan(off.openSpan(SpanKind.DATABASE, "q", statement("select * from t where a = 'x'")));
    SpanRecord q = off.finalizeTransaction().getRoot().find("q");
    assertFalse(q.getAttributes().containsKey(SpanAttributes.DB_STATEMENT));
    assertEquals("Datastore/statement/Postgres/t/select", q.getMetricName());
  }

  @Test
  void applicationExceptionIsRethrownAndRecordedOnce() {
    Transaction txn = tracer().beginUnitOfWork("checkout", true);
    IllegalStateException failure = new IllegalStateException("boom");

    Exception thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                txn.trace(
                    SpanKind.FUNCTION,
                    "outer",
                    null,
                    () ->
                        txn.trace(
                            SpanKind.FUNCTION,
                            "inner",
                            null,
                            () -> {
                              throw failure;
                            })));
    assertSame(failure, thrown);

    TransactionRecord record = txn.finalizeTransaction();
    assertEquals(1, record.getErrors().size());
    ErrorRecord error = record.getErrors().get(0);
    assertEquals(IllegalStateException.class.getName(), error.getErrorClass());
    assertEquals("boom", error.getMessage());
    assertEquals(record.getRoot().find("inner").getSpanId(), error.getSpanId());
    assertFalse(error.getStackTrace().isEmpty());
    assertEquals(
        IllegalStateException.class.getName(), record.getRoot().find("outer").getErrorClass());
    assertEquals(1, record.getMetric(MetricNames.ERRORS_ALL).getCallCount());
    assertEquals(1, record.getMetric(MetricNames.ERRORS_ALL_WEB).getCallCount());
    assertEquals(1, record.getMetric("Errors/WebTransaction/checkout").getCallCount());
  }

  @Test
  void traceReturnsTheResult() throws Exception {
    Transaction txn = tracer().beginUnitOfWork("work", false);

    assertEquals("done", txn.trace(SpanKind.CUSTOM, "step", null, () -> "done"));
    assertEquals(1, txn.finalizeTransaction().getMetric("Custom/step").getCallCount());
  }

  @Test
  void ignoredErrorClasses() {
    fixture.set("error.collector.ignore.classes", IllegalArgumentException.class.getName());
    Transaction txn = tracer().beginUnitOfWork("ignore", false);

    txn.noticeError(new IllegalArgumentException("ignored"));
    txn.noticeError(new IllegalStateException("kept"));
    TransactionRecord record = txn.finalizeTransaction();

    assertEquals(1, record.getErrors().size());
    assertEquals("kept", record.getErrors().get(0).getMessage());
    assertEquals(1, record.getMetric(MetricNames.ERRORS_ALL_OTHER).getCallCount());
  }

  @Test
  void transactionMetrics() {
    Transaction txn = tracer().beginUnitOfWork("/orders/new", true);
    SpanHandle external =
        txn.openSpan(
            SpanKind.EXTERNAL,
            "http",
            Collections.singletonMap(SpanAttributes.HTTP_URL, "https://api.example.com/v1"));
    fixture.time.advance(4 * MS);
    txn.closeSpan(external);
    SpanHandle query = txn.openSpan(SpanKind.DATABASE, "q", statement("update stock set n = 1"));
    fixture.time.advance(6 * MS);
    txn.closeSpan(query);
    TransactionRecord record = txn.finalizeTransaction();

    assertEquals("WebTransaction/orders/new", record.getMetricName());
    assertEquals(10 * MS, record.getMetric("WebTransaction/orders/new").getTotalNanos());
    assertEquals(1, record.getMetric(MetricNames.WEB_TRANSACTION).getCallCount());
    assertEquals(10 * MS, record.getMetric(MetricNames.WEB_TRANSACTION_TOTAL_TIME).getTotalNanos());
    assertEquals(1, record.getMetric("WebTransactionTotalTime/orders/new").getCallCount());
    assertEquals(1, record.getMetric("External/all").getCallCount());
    assertEquals(1, record.getMetric("External/allWeb").getCallCount());
    assertEquals(1, record.getMetric("External/api.example.com/all").getCallCount());
    assertEquals(1, record.getScopedMetric("External/api.example.com/http/Unknown").getCallCount());
    assertEquals(6 * MS, record.getMetric("Datastore/allWeb").getTotalNanos());
    assertEquals(1, record.getMetric("Datastore/Postgres/allWeb").getCallCount());
    assertEquals(1, record.getMetric("Datastore/operation/Postgres/update").getCallCount());
    assertNull(record.getMetric("Datastore/allOther"));
  }

  @Test
  void backgroundTransactionMetrics() {
    Transaction txn = tracer().beginUnitOfWork("nightly", true);
    txn.setWeb(false);
    txn.setName("reindex");
    txn.closeSpan(txn.openSpan(SpanKind.DATASTORE, "get"));
    TransactionRecord record = txn.finalizeTransaction();

    assertEquals("OtherTransaction/reindex", record.getMetricName());
    assertEquals(1, record.getMetric(MetricNames.OTHER_TRANSACTION_ALL).getCallCount());
    assertEquals(1, record.getMetric("Datastore/allOther").getCallCount());
    assertNull(record.getMetric(MetricNames.WEB_TRANSACTION));
    assertEquals("reindex", record.getRoot().getName());
  }

  @Test
  void renamingAfterFinalizeIsIgnored() {
    Transaction txn = tracer().beginUnitOfWork("original", false);
    TransactionRecord record = txn.finalizeTransaction();

    txn.setName("renamed");

    assertEquals("original", txn.getName());
    assertEquals("original", record.getName());
  }

  @Test
  void metricsFromOtherThreadsAreMerged() throws Exception {
    Transaction txn = tracer().beginUnitOfWork("async", false);
    MetricTable worker = new MetricTable();
    Thread thread = new Thread(() -> worker.record("Custom/worker", 40 * MS, 40 * MS));
    thread.start();
    thread.join();

    txn.mergeMetrics(worker);
    TransactionRecord record = txn.finalizeTransaction();

    assertEquals(40 * MS, record.getMetric("Custom/worker").getTotalNanos());
  }

  @Test
  void attributesAfterCloseAreIgnored() {
    Transaction txn = tracer().beginUnitOfWork("attrs", false);
    SpanHandle span = txn.openSpan(SpanKind.FUNCTION, "span");
    txn.addSpanAttribute(span, "before", 1);
    txn.closeSpan(span);
    txn.addSpanAttribute(span, "after", 2);

    Map<String, Object> attributes =
        txn.finalizeTransaction().getRoot().find("span").getAttributes();
    assertEquals(1, attributes.get("before"));
    assertFalse(attributes.containsKey("after"));
  }

  @Test
  void spansNameTheMethodThatOpenedThem() {
    Transaction txn = tracer().beginUnitOfWork("source", false);
    txn.closeSpan(txn.openSpan(SpanKind.FUNCTION, "traced"));

    Map<String, Object> attributes =
        txn.finalizeTransaction().getRoot().find("traced").getAttributes();
    assertEquals(
        TransactionTest.class.getName() + ".spansNameTheMethodThatOpenedThem",
        attributes.get(SpanAttributes.CODE_CALLABLE_NAME));
    assertEquals("TransactionTest.java", attributes.get(SpanAttributes.CODE_FILE_PATH));
    assertTrue((Integer) attributes.get(SpanAttributes.CODE_LINE_NUMBER) > 0);
  }

  @Test
  void sourceCodeContextCanBeSwitchedOff() {
    fixture.set("trace.source.code.context.enabled", "false");
    Transaction txn = tracer().beginUnitOfWork("source", false);
    txn.closeSpan(txn.openSpan(SpanKind.FUNCTION, "traced"));

    Map<String, Object> attributes =
        txn.finalizeTransaction().getRoot().find("traced").getAttributes();
    assertFalse(attributes.containsKey(SpanAttributes.CODE_CALLABLE_NAME));
    assertFalse(attributes.containsKey(SpanAttributes.CODE_LINE_NUMBER));
    assertFalse(attributes.containsKey(SpanAttributes.CODE_FILE_PATH));
  }

  private static Map<String, Object> postgresInstance() {
    Map<String, Object> attributes = statement("SELECT setting from pg_settings where name = 'x'");
    attributes.put(SpanAttributes.DB_NAME, "inventory");
    attributes.put(SpanAttributes.SERVER_ADDRESS, "db-1");
    attributes.put(SpanAttributes.SERVER_PORT, 5432);
    return attributes;
  }

  @Test
  void databaseSpansReportTheirInstance() {
    Transaction txn = tracer().beginUnitOfWork("instance", false);
    txn.closeSpan(txn.openSpan(SpanKind.DATABASE, "query", postgresInstance()));
    TransactionRecord record = txn.finalizeTransaction();

    Map<String, Object> attributes = record.getRoot().find("query").getAttributes();
    assertEquals("inventory", attributes.get(SpanAttributes.DB_INSTANCE));
    assertEquals("db-1", attributes.get(SpanAttributes.PEER_HOSTNAME));
    assertEquals("db-1:5432", attributes.get(SpanAttributes.PEER_ADDRESS));
    assertEquals(1, record.getMetric("Datastore/instance/Postgres/db-1/5432").getCallCount());
  }

  @Test
  void instanceReportingSwitchedOffReadsUnknown() {
    fixture
        .set("datastore.instance.reporting.enabled", "false")
        .set("datastore.database.name.reporting.enabled", "false");
    Transaction txn = tracer().beginUnitOfWork("instance", false);
    txn.closeSpan(txn.openSpan(SpanKind.DATABASE, "query", postgresInstance()));
    TransactionRecord record = txn.finalizeTransaction();

    Map<String, Object> attributes = record.getRoot().find("query").getAttributes();
    assertEquals("Unknown", attributes.get(SpanAttributes.DB_INSTANCE));
    assertEquals("Unknown", attributes.get(SpanAttributes.PEER_HOSTNAME));
    assertEquals("Unknown:Unknown", attributes.get(SpanAttributes.PEER_ADDRESS));
    assertNull(record.getMetric("Datastore/instance/Postgres/db-1/5432"));
  }

  @Test
  void datastoresWithoutADatabaseNameHaveNoInstance() {
    Transaction txn = tracer().beginUnitOfWork("cache", false);
    Map<String, Object> memcached = new HashMap<>();
    memcached.put(SpanAttributes.DB_SYSTEM, "Memcached");
    memcached.put(SpanAttributes.SERVER_ADDRESS, "cache-1");
    txn.closeSpan(txn.openSpan(SpanKind.DATASTORE, "get", memcached));

    Map<String, Object> attributes =
        txn.finalizeTransaction().getRoot().find("get").getAttributes();
    assertFalse(attributes.containsKey(SpanAttributes.DB_INSTANCE));
    assertEquals("cache-1", attributes.get(SpanAttributes.PEER_HOSTNAME));
    assertEquals("cache-1:Unknown", attributes.get(SpanAttributes.PEER_ADDRESS));
  }

  @Test
  void outboundHeadersIdentifyTheInnermostSpan() {
    fixture.set("account.id", "33").set("primary.application.id", "2827902");
    Transaction txn = tracer().beginUnitOfWork("caller", true);
    SpanHandle external = txn.openSpan(SpanKind.EXTERNAL, "call");

    Map<String, String> headers = txn.outboundHeaders();

    String traceParent = headers.get("traceparent");
    assertEquals("00-" + txn.getTraceId() + "-" + external.getSpanId() + "-01", traceParent);
    assertTrue(
        headers.get("tracestate").startsWith("33@nr=0-0-33-2827902-" + external.getSpanId()));
    assertNotNull(headers.get("newrelic"));
  }
}
