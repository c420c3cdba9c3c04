package lumen.trace.common.writer;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lumen.trace.api.Config;
import lumen.trace.api.time.ControllableTimeSource;
import lumen.trace.common.metrics.NoOpMetricsAggregator;
import lumen.trace.common.sampling.AllSampler;
import lumen.trace.core.SpanHandle;
import lumen.trace.core.SpanKind;
import lumen.trace.core.Tracer;
import lumen.trace.core.Transaction;
import lumen.trace.core.TransactionRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransactionRecordJsonAdapterTest {

  private static final JsonAdapter<Map<String, Object>> MAP_ADAPTER =
      new Moshi.Builder()
          .build()
          .adapter(Types.newParameterizedType(Map.class, String.class, Object.class));

  private final ControllableTimeSource time = new ControllableTimeSource();
  private Tracer tracer;

  @BeforeEach
  void setUp() {
    Map<String, String> settings = new HashMap<>();
    settings.put("trace.stack.trace.threshold", "0");
    tracer =
        Tracer.builder()
            .config(Config.from(settings))
            .timeSource(time)
            .sampler(new AllSampler())
            .metricsAggregator(NoOpMetricsAggregator.INSTANCE)
            .build();
  }

  @AfterEach
  void tearDown() {
    tracer.close();
  }

  private TransactionRecord checkout() {
    Transaction txn = tracer.beginUnitOfWork("checkout", true);
    SpanHandle handler = txn.openSpan(SpanKind.FUNCTION, "handler");
    time.advance(10, MILLISECONDS);
    Map<String, Object> attributes = new HashMap<>();
    attributes.put("db.system", "Postgres");
    attributes.put("db.statement", "select * from users where id = 1");
    attributes.put("server.port", 5432);
    SpanHandle query = txn.openSpan(SpanKind.DATABASE, "query", attributes);
    time.advance(5, MILLISECONDS);
    txn.closeSpan(query);
    txn.closeSpan(handler, new IllegalStateException("card declined"));
    return tracer.endUnitOfWork(txn);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> child(Map<String, Object> span, int index) {
    return ((List<Map<String, Object>>) span.get("children")).get(index);
  }

  @Test
  @SuppressWarnings("unchecked")
  void writesTheWholeRecord() throws Exception {
    TransactionRecord record = checkout();

    Map<String, Object> json =
        MAP_ADAPTER.fromJson(LoggingTraceInterceptor.RECORD_ADAPTER.toJson(record));

    assertEquals(record.getGuid(), json.get("guid"));
    assertEquals("checkout", json.get("name"));
    assertEquals("WebTransaction/checkout", json.get("metric_name"));
    assertEquals(true, json.get("web"));
    assertEquals(true, json.get("sampled"));
    assertEquals(record.getTraceId(), json.get("trace_id"));
    assertFalse(json.containsKey("parent_id"));
    assertEquals(15_000_000d, json.get("duration"));
    assertEquals(0d, json.get("dropped_spans"));

    Map<String, Object> root = (Map<String, Object>) json.get("root");
    assertEquals("checkout", root.get("name"));
    Map<String, Object> handler = child(root, 0);
    assertEquals("handler", handler.get("name"));
    assertEquals("FUNCTION", handler.get("kind"));
    assertEquals("java.lang.IllegalStateException", handler.get("error_class"));
    assertEquals("card declined", handler.get("error_message"));
    assertEquals(10_000_000d, handler.get("exclusive"));

    Map<String, Object> query = child(handler, 0);
    assertEquals("Datastore/statement/Postgres/users/select", query.get("metric_name"));
    assertEquals(10_000_000d, query.get("start_offset"));
    Map<String, Object> attributes = (Map<String, Object>) query.get("attributes");
    assertEquals("select * from users where id = ?", attributes.get("db.statement"));
    assertEquals(5432d, attributes.get("server.port"));
    assertTrue(query.containsKey("stack_trace"));
    assertTrue(((List<Object>) query.get("children")).isEmpty());

    List<Map<String, Object>> errors = (List<Map<String, Object>>) json.get("errors");
    assertEquals(1, errors.size());
    assertEquals("card declined", errors.get(0).get("message"));

    List<Map<String, Object>> metrics = (List<Map<String, Object>>) json.get("metrics");
    assertEquals(record.getMetrics().size(), metrics.size());
    boolean scopedQuery = false;
    for (Map<String, Object> metric : metrics) {
      if ("Datastore/statement/Postgres/users/select".equals(metric.get("name"))
          && "WebTransaction/checkout".equals(metric.get("scope"))) {
        scopedQuery = true;
        assertEquals(1d, metric.get("count"));
        assertEquals(5_000_000d, metric.get("total"));
      }
    }
    assertTrue(scopedQuery);
  }

  @Test
  void nonFiniteAttributesAreWrittenAsStrings() throws Exception {
    Transaction txn = tracer.beginUnitOfWork("ratios", false);
    Map<String, Object> attributes = new HashMap<>();
    attributes.put("ratio", Double.NaN);
    attributes.put("ceiling", Float.POSITIVE_INFINITY);
    attributes.put("count", 3);
    txn.closeSpan(txn.openSpan(SpanKind.CUSTOM, "compute", attributes));
    TransactionRecord record = tracer.endUnitOfWork(txn);

    Map<String, Object> json =
        MAP_ADAPTER.fromJson(LoggingTraceInterceptor.RECORD_ADAPTER.toJson(record));

    @SuppressWarnings("unchecked")
    Map<String, Object> spanAttributes =
        (Map<String, Object>) child((Map<String, Object>) json.get("root"), 0).get("attributes");
    assertEquals("NaN", spanAttributes.get("ratio"));
    assertEquals("Infinity", spanAttributes.get("ceiling"));
    assertEquals(3d, spanAttributes.get("count"));
  }

  @Test
  void nullRecord() {
    assertEquals("null", LoggingTraceInterceptor.RECORD_ADAPTER.toJson(null));
  }

  @Test
  void readingIsNotSupported() {
    assertThrows(
        UnsupportedOperationException.class,
        () -> LoggingTraceInterceptor.RECORD_ADAPTER.fromJson("{}"));
  }

  @Test
  void interceptorLogsWithoutFailing() {
    LoggingTraceInterceptor interceptor = new LoggingTraceInterceptor();

    interceptor.onTransactionFinalized(checkout());

    assertEquals(Integer.MAX_VALUE, interceptor.priority());
  }
}
