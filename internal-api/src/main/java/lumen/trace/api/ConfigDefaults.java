package lumen.trace.api;

public final class ConfigDefaults {

  static final String DEFAULT_APP_NAME = "Java Application";

  static final int DEFAULT_TRACE_MAX_DEPTH = 300;
  static final int DEFAULT_TRACE_MAX_SPANS = 3000;
  static final long DEFAULT_TRACE_SEGMENT_THRESHOLD_MS = 0;
  static final long DEFAULT_TRACE_STACK_TRACE_THRESHOLD_MS = 500;
  static final int DEFAULT_TRACE_STACK_TRACE_MAX_FRAMES = 30;
  static final boolean DEFAULT_TRACE_EXPLAIN_ENABLED = true;
  static final long DEFAULT_TRACE_EXPLAIN_THRESHOLD_MS = 500;
  static final long DEFAULT_TRACE_EXPLAIN_TIMEOUT_MS = 100;
  static final String DEFAULT_TRACE_EXPLAIN_VERBS = "select,insert,update,delete";
  static final String DEFAULT_TRACE_SQL_RECORD = "obfuscated";
  static final boolean DEFAULT_TRACE_STRICT_MODE = false;
  static final boolean DEFAULT_TRACE_SOURCE_CODE_CONTEXT_ENABLED = true;

  static final boolean DEFAULT_DATASTORE_INSTANCE_REPORTING_ENABLED = true;
  static final boolean DEFAULT_DATASTORE_DATABASE_NAME_REPORTING_ENABLED = true;

  static final boolean DEFAULT_DISTRIBUTED_TRACING_ENABLED = true;
  static final boolean DEFAULT_CROSS_APPLICATION_TRACER_ENABLED = false;

  static final int DEFAULT_SAMPLING_TARGET = 10;
  static final int DEFAULT_SAMPLING_INTERVAL_SECONDS = 60;

  static final int DEFAULT_METRICS_REPORTING_INTERVAL_SECONDS = 60;

  static final int DEFAULT_ERROR_COLLECTOR_MAX = 20;

  private ConfigDefaults() {}
}
