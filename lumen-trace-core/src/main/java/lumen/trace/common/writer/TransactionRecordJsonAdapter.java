package lumen.trace.common.writer;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lumen.trace.common.metrics.MetricKey;
import lumen.trace.common.metrics.MetricStats;
import lumen.trace.core.ErrorRecord;
import lumen.trace.core.SpanRecord;
import lumen.trace.core.TransactionRecord;

/** Write-only JSON form of a finalized transaction, span tree and metrics included. */
class TransactionRecordJsonAdapter extends JsonAdapter<TransactionRecord> {

  public static Factory buildFactory() {
    return new Factory() {
      @Override
      public JsonAdapter<?> create(
          final Type type, final Set<? extends Annotation> annotations, final Moshi moshi) {
        final Class<?> rawType = Types.getRawType(type);
        if (rawType.isAssignableFrom(TransactionRecord.class)) {
          return new TransactionRecordJsonAdapter();
        }
        return null;
      }
    };
  }

  @Override
  public TransactionRecord fromJson(final JsonReader reader) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void toJson(final JsonWriter writer, final TransactionRecord record) throws IOException {
    if (record == null) {
      writer.nullValue();
      return;
    }
    writer.beginObject();
    writer.name("guid");
    writer.value(record.getGuid());
    writer.name("name");
    writer.value(record.getName());
    writer.name("metric_name");
    writer.value(record.getMetricName());
    writer.name("web");
    writer.value(record.isWeb());
    writer.name("start");
    writer.value(record.getStartTimeMillis());
    writer.name("duration");
    writer.value(record.getDurationNanos());
    writer.name("trace_id");
    writer.value(record.getTraceId());
    writer.name("parent_id");
    writer.value(record.getParentSpanId());
    writer.name("sampled");
    writer.value(record.isSampled());
    writer.name("priority");
    writer.value(record.getPriority());
    writer.name("dropped_spans");
    writer.value(record.getDroppedSpanCount());
    writer.name("root");
    writeSpan(writer, record.getRoot());
    writer.name("errors");
    writer.beginArray();
    for (final ErrorRecord error : record.getErrors()) {
      writeError(writer, error);
    }
    writer.endArray();
    writer.name("metrics");
    writer.beginArray();
    for (final Map.Entry<MetricKey, MetricStats> entry : record.getMetrics().entries().entrySet()) {
      writeMetric(writer, entry.getKey(), entry.getValue());
    }
    writer.endArray();
    writer.endObject();
  }

  private void writeSpan(final JsonWriter writer, final SpanRecord span) throws IOException {
    writer.beginObject();
    writer.name("span_id");
    writer.value(span.getSpanId());
    writer.name("kind");
    writer.value(span.getKind().name());
    writer.name("name");
    writer.value(span.getName());
    writer.name("metric_name");
    writer.value(span.getMetricName());
    writer.name("start_offset");
    writer.value(span.getStartOffsetNanos());
    writer.name("duration");
    writer.value(span.getDurationNanos());
    writer.name("exclusive");
    writer.value(span.getExclusiveNanos());
    writer.name("attributes");
    writer.beginObject();
    for (final Map.Entry<String, Object> entry : span.getAttributes().entrySet()) {
      writer.name(entry.getKey());
      final Object value = entry.getValue();
      if (value instanceof Number && isFinite((Number) value)) {
        writer.value((Number) value);
      } else if (value instanceof Boolean) {
        writer.value((Boolean) value);
      } else {
        writer.value(String.valueOf(value));
      }
    }
    writer.endObject();
    if (span.getStackTrace() != null) {
      writer.name("stack_trace");
      writeLines(writer, span.getStackTrace());
    }
    if (span.getExplainPlan() != null) {
      writer.name("explain_plan");
      writer.value(span.getExplainPlan());
    }
    if (span.getErrorClass() != null) {
      writer.name("error_class");
      writer.value(span.getErrorClass());
      writer.name("error_message");
      writer.value(span.getErrorMessage());
    }
    writer.name("children");
    writer.beginArray();
    for (final SpanRecord child : span.getChildren()) {
      writeSpan(writer, child);
    }
    writer.endArray();
    writer.endObject();
  }

  // JSON has no NaN or Infinity; those are written as strings
  private static boolean isFinite(final Number number) {
    if (number instanceof Double || number instanceof Float) {
      return Double.isFinite(number.doubleValue());
    }
    return true;
  }

  private void writeError(final JsonWriter writer, final ErrorRecord error) throws IOException {
    writer.beginObject();
    writer.name("timestamp");
    writer.value(error.getTimestampMillis());
    writer.name("error_class");
    writer.value(error.getErrorClass());
    writer.name("message");
    writer.value(error.getMessage());
    writer.name("span_id");
    writer.value(error.getSpanId());
    writer.name("stack_trace");
    writeLines(writer, error.getStackTrace());
    writer.endObject();
  }

  private void writeMetric(final JsonWriter writer, final MetricKey key, final MetricStats stats)
      throws IOException {
    writer.beginObject();
    writer.name("name");
    writer.value(key.getName());
    if (key.isScoped()) {
      writer.name("scope");
      writer.value(key.getScope());
    }
    writer.name("count");
    writer.value(stats.getCallCount());
    writer.name("total");
    writer.value(stats.getTotalNanos());
    writer.name("exclusive");
    writer.value(stats.getExclusiveNanos());
    writer.name("min");
    writer.value(stats.getMinNanos());
    writer.name("max");
    writer.value(stats.getMaxNanos());
    writer.name("sum_of_squares");
    writer.value(stats.getSumOfSquares());
    writer.endObject();
  }

  private void writeLines(final JsonWriter writer, final List<String> lines) throws IOException {
    writer.beginArray();
    if (lines != null) {
      for (final String line : lines) {
        writer.value(line);
      }
    }
    writer.endArray();
  }
}
