package lumen.trace.api.config;

/**
 * Tracer setting names. System properties carry the {@code lumen.} prefix, environment variables
 * the {@code LUMEN_} prefix in upper case with '.' replaced by '_'.
 */
public final class TracerConfig {
  public static final String APP_NAME = "app.name";

  public static final String TRACE_MAX_DEPTH = "trace.max.depth";
  public static final String TRACE_MAX_SPANS = "trace.max.spans";
  public static final String TRACE_SEGMENT_THRESHOLD = "trace.segment.threshold";
  public static final String TRACE_STACK_TRACE_THRESHOLD = "trace.stack.trace.threshold";
  public static final String TRACE_STACK_TRACE_MAX_FRAMES = "trace.stack.trace.max.frames";
  public static final String TRACE_EXPLAIN_ENABLED = "trace.explain.enabled";
  public static final String TRACE_EXPLAIN_THRESHOLD = "trace.explain.threshold";
  public static final String TRACE_EXPLAIN_TIMEOUT = "trace.explain.timeout";
  public static final String TRACE_EXPLAIN_VERBS = "trace.explain.verbs";
  public static final String TRACE_SQL_RECORD = "trace.sql.record";
  public static final String TRACE_STRICT_MODE = "trace.strict.mode";
  public static final String TRACE_SOURCE_CODE_CONTEXT_ENABLED =
      "trace.source.code.context.enabled";

  public static final String DATASTORE_INSTANCE_REPORTING_ENABLED =
      "datastore.instance.reporting.enabled";
  public static final String DATASTORE_DATABASE_NAME_REPORTING_ENABLED =
      "datastore.database.name.reporting.enabled";

  public static final String DISTRIBUTED_TRACING_ENABLED = "distributed.tracing.enabled";
  public static final String CROSS_APPLICATION_TRACER_ENABLED =
      "cross.application.tracer.enabled";
  public static final String ACCOUNT_ID = "account.id";
  public static final String PRIMARY_APPLICATION_ID = "primary.application.id";
  public static final String TRUSTED_ACCOUNT_KEY = "trusted.account.key";
  public static final String TRUSTED_ACCOUNT_IDS = "trusted.account.ids";
  public static final String CROSS_PROCESS_ID = "cross.process.id";
  public static final String ENCODING_KEY = "encoding.key";

  public static final String SAMPLING_TARGET = "sampling.target";
  public static final String SAMPLING_INTERVAL = "sampling.interval";

  public static final String METRICS_REPORTING_INTERVAL = "metrics.reporting.interval";

  public static final String ERROR_COLLECTOR_IGNORE_CLASSES = "error.collector.ignore.classes";
  public static final String ERROR_COLLECTOR_MAX = "error.collector.max";

  private TracerConfig() {}
}
