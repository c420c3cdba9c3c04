package lumen.trace.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import lumen.trace.api.Config;
import lumen.trace.common.metrics.MetricsAggregator;
import lumen.trace.core.propagation.HttpCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TracerTest {

  private static final String TRACE_ID = "0af7651916cd43dd8448eb211c80319c";
  private static final String PARENT_ID = "b7ad6b7169203331";

  @Mock MetricsAggregator aggregator;
  @Mock TraceInterceptor first;
  @Mock TraceInterceptor second;
  @Mock HttpCodec.Extractor extractor;

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

  @Test
  void startsAndStopsTheAggregator() {
    fixture.aggregator(aggregator).build().close();

    verify(aggregator).start();
    verify(aggregator).close();
  }

  @Test
  void extractorStateIsKeptBetweenRequests() {
    tracer = fixture.extractor(extractor).build();
    Map<String, String> headers = Collections.singletonMap("traceparent", "garbage");

    tracer.beginUnitOfWork("first", true, headers);
    tracer.beginUnitOfWork("second", true, headers);

    verify(extractor, times(2)).extract(any(), any());
    verify(extractor, never()).cleanup();
  }

  @Test
  void newTraceWithoutHeaders() {
    Transaction txn = tracer().beginUnitOfWork("root", true);
    TransactionRecord record = tracer.endUnitOfWork(txn);

    assertEquals(32, record.getTraceId().length());
    assertNull(record.getParentSpanId());
    assertNull(txn.getParentContext());
    assertTrue(record.isSampled());
    assertTrue(record.getPriority() >= 1.0f);
    assertNull(record.getMetric(MetricNames.ACCEPT_PAYLOAD_SUCCESS));
    assertNull(record.getMetric(MetricNames.ACCEPT_PAYLOAD_IGNORED_NULL));
  }

  @Test
  void joinsTraceFromTraceParent() {
    Map<String, String> headers =
        Collections.singletonMap("traceparent", "00-" + TRACE_ID + "-" + PARENT_ID + "-00");

    Transaction txn = tracer().beginUnitOfWork("joined", true, headers);
    TransactionRecord record = tracer.endUnitOfWork(txn);

    assertEquals(TRACE_ID, record.getTraceId());
    assertEquals(PARENT_ID, record.getParentSpanId());
    // the caller decided not to sample
    assertFalse(record.isSampled());
    assertTrue(record.getPriority() < 1.0f);
    assertEquals(1, record.getMetric(MetricNames.ACCEPT_PAYLOAD_SUCCESS).getCallCount());
  }

  @Test
  void honoursUpstreamPriority() {
    fixture.set("account.id", "33");
    Map<String, String> headers = new HashMap<>();
    headers.put("traceparent", "00-" + TRACE_ID + "-" + PARENT_ID + "-01");
    headers.put(
        "tracestate",
        "33@nr=0-0-33-2827902-" + PARENT_ID + "-e8b91a159289ff74-1-1.23456-1518469636035");

    Transaction txn = tracer().beginUnitOfWork("joined", true, headers);

    assertTrue(txn.isSampled());
    assertEquals(1.23456f, txn.getPriority());
    assertEquals("e8b91a159289ff74", txn.getParentContext().getTransactionId());
    assertEquals(1518469636035L, txn.getParentContext().getTimestampMillis());
  }

  @Test
  void garbageHeadersStartANewTrace() {
    Map<String, String> headers = Collections.singletonMap("traceparent", "garbage");

    Transaction txn = tracer().beginUnitOfWork("fresh", false, headers);
    TransactionRecord record = tracer.endUnitOfWork(txn);

    assertNotEquals(TRACE_ID, record.getTraceId());
    assertEquals(32, record.getTraceId().length());
    assertNull(record.getParentSpanId());
    assertEquals(1, record.getMetric(MetricNames.ACCEPT_PAYLOAD_PARSE_EXCEPTION).getCallCount());
  }

  @Test
  void headersWithoutPayload() {
    Map<String, String> headers = Collections.singletonMap("accept", "text/html");

    TransactionRecord record =
        tracer().endUnitOfWork(tracer.beginUnitOfWork("plain", true, headers));

    assertEquals(1, record.getMetric(MetricNames.ACCEPT_PAYLOAD_IGNORED_NULL).getCallCount());
  }

  @Test
  void distributedTracingDisabledIgnoresHeaders() {
    fixture.set("distributed.tracing.enabled", "false");
    Map<String, String> headers =
        Collections.singletonMap("traceparent", "00-" + TRACE_ID + "-" + PARENT_ID + "-01");

    TransactionRecord record =
        tracer().endUnitOfWork(tracer.beginUnitOfWork("isolated", true, headers));

    assertNotEquals(TRACE_ID, record.getTraceId());
    assertNull(record.getMetric(MetricNames.ACCEPT_PAYLOAD_SUCCESS));
  }

  @Test
  void interceptorsRunInPriorityOrderAndFailuresAreSwallowed() {
    when(first.priority()).thenReturn(1);
    when(second.priority()).thenReturn(2);
    doThrow(new IllegalStateException("exporter down"))
        .when(first)
        .onTransactionFinalized(any());
    tracer =
        Tracer.builder()
            .config(Config.from(fixture.settings))
            .timeSource(fixture.time)
            .metricsAggregator(aggregator)
            .interceptor(second)
            .interceptor(first)
            .build();

    Transaction txn = tracer.beginUnitOfWork("intercepted", true);
    TransactionRecord record = tracer.endUnitOfWork(txn);

    InOrder order = inOrder(first, second);
    order.verify(first).onTransactionFinalized(record);
    order.verify(second).onTransactionFinalized(record);
    verify(aggregator).submit(record);
  }

  @Test
  void endingNothing() {
    tracer = fixture.aggregator(aggregator).build();

    assertNull(tracer.endUnitOfWork(null));
    verify(aggregator, never()).submit(any(TransactionRecord.class));
  }

  @Test
  void interceptorSeesTheRecordReturnedByFinalize() {
    tracer = fixture.interceptor(first).build();
    Transaction txn = tracer.beginUnitOfWork("seen", false);

    TransactionRecord record = txn.finalizeTransaction();

    verify(first).onTransactionFinalized(record);
    assertSame(record, tracer.endUnitOfWork(txn));
  }
}
