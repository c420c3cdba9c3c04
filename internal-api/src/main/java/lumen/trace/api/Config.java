package lumen.trace.api;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_APP_NAME;
import static lumen.trace.api.ConfigDefaults.DEFAULT_CROSS_APPLICATION_TRACER_ENABLED;
import static lumen.trace.api.ConfigDefaults.DEFAULT_DATASTORE_DATABASE_NAME_REPORTING_ENABLED;
import static lumen.trace.api.ConfigDefaults.DEFAULT_DATASTORE_INSTANCE_REPORTING_ENABLED;
import static lumen.trace.api.ConfigDefaults.DEFAULT_DISTRIBUTED_TRACING_ENABLED;
import static lumen.trace.api.ConfigDefaults.DEFAULT_ERROR_COLLECTOR_MAX;
import static lumen.trace.api.ConfigDefaults.DEFAULT_METRICS_REPORTING_INTERVAL_SECONDS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_SAMPLING_INTERVAL_SECONDS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_SAMPLING_TARGET;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_EXPLAIN_ENABLED;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_EXPLAIN_THRESHOLD_MS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_EXPLAIN_TIMEOUT_MS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_EXPLAIN_VERBS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_MAX_DEPTH;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_MAX_SPANS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_SEGMENT_THRESHOLD_MS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_SOURCE_CODE_CONTEXT_ENABLED;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_SQL_RECORD;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_STACK_TRACE_MAX_FRAMES;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_STACK_TRACE_THRESHOLD_MS;
import static lumen.trace.api.ConfigDefaults.DEFAULT_TRACE_STRICT_MODE;
import static lumen.trace.api.config.TracerConfig.ACCOUNT_ID;
import static lumen.trace.api.config.TracerConfig.APP_NAME;
import static lumen.trace.api.config.TracerConfig.CROSS_APPLICATION_TRACER_ENABLED;
import static lumen.trace.api.config.TracerConfig.CROSS_PROCESS_ID;
import static lumen.trace.api.config.TracerConfig.DATASTORE_DATABASE_NAME_REPORTING_ENABLED;
import static lumen.trace.api.config.TracerConfig.DATASTORE_INSTANCE_REPORTING_ENABLED;
import static lumen.trace.api.config.TracerConfig.DISTRIBUTED_TRACING_ENABLED;
import static lumen.trace.api.config.TracerConfig.ENCODING_KEY;
import static lumen.trace.api.config.TracerConfig.ERROR_COLLECTOR_IGNORE_CLASSES;
import static lumen.trace.api.config.TracerConfig.ERROR_COLLECTOR_MAX;
import static lumen.trace.api.config.TracerConfig.METRICS_REPORTING_INTERVAL;
import static lumen.trace.api.config.TracerConfig.PRIMARY_APPLICATION_ID;
import static lumen.trace.api.config.TracerConfig.SAMPLING_INTERVAL;
import static lumen.trace.api.config.TracerConfig.SAMPLING_TARGET;
import static lumen.trace.api.config.TracerConfig.TRACE_EXPLAIN_ENABLED;
import static lumen.trace.api.config.TracerConfig.TRACE_EXPLAIN_THRESHOLD;
import static lumen.trace.api.config.TracerConfig.TRACE_EXPLAIN_TIMEOUT;
import static lumen.trace.api.config.TracerConfig.TRACE_EXPLAIN_VERBS;
import static lumen.trace.api.config.TracerConfig.TRACE_MAX_DEPTH;
import static lumen.trace.api.config.TracerConfig.TRACE_MAX_SPANS;
import static lumen.trace.api.config.TracerConfig.TRACE_SEGMENT_THRESHOLD;
import static lumen.trace.api.config.TracerConfig.TRACE_SOURCE_CODE_CONTEXT_ENABLED;
import static lumen.trace.api.config.TracerConfig.TRACE_SQL_RECORD;
import static lumen.trace.api.config.TracerConfig.TRACE_STACK_TRACE_MAX_FRAMES;
import static lumen.trace.api.config.TracerConfig.TRACE_STACK_TRACE_THRESHOLD;
import static lumen.trace.api.config.TracerConfig.TRACE_STRICT_MODE;
import static lumen.trace.api.config.TracerConfig.TRUSTED_ACCOUNT_IDS;
import static lumen.trace.api.config.TracerConfig.TRUSTED_ACCOUNT_KEY;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lumen.trace.bootstrap.config.provider.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot of the tracer settings. Every transaction captures the snapshot current at
 * its start, so thresholds never change under a running unit of work.
 */
public class Config {

  private static final Logger log = LoggerFactory.getLogger(Config.class);

  private final String appName;

  private final int traceMaxDepth;
  private final int traceMaxSpans;
  private final long traceSegmentThresholdMs;
  private final long traceStackTraceThresholdMs;
  private final int traceStackTraceMaxFrames;
  private final boolean traceExplainEnabled;
  private final long traceExplainThresholdMs;
  private final long traceExplainTimeoutMs;
  private final Set<String> traceExplainVerbs;
  private final SqlRecordMode traceSqlRecordMode;
  private final boolean traceStrictMode;
  private final boolean traceSourceCodeContextEnabled;

  private final boolean datastoreInstanceReportingEnabled;
  private final boolean datastoreDatabaseNameReportingEnabled;

  private final boolean distributedTracingEnabled;
  private final boolean crossApplicationTracerEnabled;
  private final String accountId;
  private final String primaryApplicationId;
  private final String trustedAccountKey;
  private final Set<String> trustedAccountIds;
  private final String crossProcessId;
  private final String encodingKey;

  private final int samplingTarget;
  private final int samplingIntervalSeconds;

  private final int metricsReportingIntervalSeconds;

  private final Set<String> errorCollectorIgnoreClasses;
  private final int errorCollectorMax;

  private Config(final ConfigProvider configProvider) {
    appName = configProvider.getString(APP_NAME, DEFAULT_APP_NAME);

    traceMaxDepth =
        atLeast(
            TRACE_MAX_DEPTH,
            configProvider.getInteger(TRACE_MAX_DEPTH, DEFAULT_TRACE_MAX_DEPTH),
            1,
            DEFAULT_TRACE_MAX_DEPTH);
    traceMaxSpans =
        atLeast(
            TRACE_MAX_SPANS,
            configProvider.getInteger(TRACE_MAX_SPANS, DEFAULT_TRACE_MAX_SPANS),
            1,
            DEFAULT_TRACE_MAX_SPANS);
    traceSegmentThresholdMs =
        atLeast(
            TRACE_SEGMENT_THRESHOLD,
            configProvider.getLong(TRACE_SEGMENT_THRESHOLD, DEFAULT_TRACE_SEGMENT_THRESHOLD_MS),
            0,
            DEFAULT_TRACE_SEGMENT_THRESHOLD_MS);
    traceStackTraceThresholdMs =
        atLeast(
            TRACE_STACK_TRACE_THRESHOLD,
            configProvider.getLong(
                TRACE_STACK_TRACE_THRESHOLD, DEFAULT_TRACE_STACK_TRACE_THRESHOLD_MS),
            0,
            DEFAULT_TRACE_STACK_TRACE_THRESHOLD_MS);
    traceStackTraceMaxFrames =
        atLeast(
            TRACE_STACK_TRACE_MAX_FRAMES,
            configProvider.getInteger(
                TRACE_STACK_TRACE_MAX_FRAMES, DEFAULT_TRACE_STACK_TRACE_MAX_FRAMES),
            1,
            DEFAULT_TRACE_STACK_TRACE_MAX_FRAMES);
    traceExplainEnabled =
        configProvider.getBoolean(TRACE_EXPLAIN_ENABLED, DEFAULT_TRACE_EXPLAIN_ENABLED);
    traceExplainThresholdMs =
        atLeast(
            TRACE_EXPLAIN_THRESHOLD,
            configProvider.getLong(TRACE_EXPLAIN_THRESHOLD, DEFAULT_TRACE_EXPLAIN_THRESHOLD_MS),
            0,
            DEFAULT_TRACE_EXPLAIN_THRESHOLD_MS);
    traceExplainTimeoutMs =
        atLeast(
            TRACE_EXPLAIN_TIMEOUT,
            configProvider.getLong(TRACE_EXPLAIN_TIMEOUT, DEFAULT_TRACE_EXPLAIN_TIMEOUT_MS),
            1,
            DEFAULT_TRACE_EXPLAIN_TIMEOUT_MS);
    traceExplainVerbs =
        lowerCase(configProvider.getSet(TRACE_EXPLAIN_VERBS, DEFAULT_TRACE_EXPLAIN_VERBS));
    traceSqlRecordMode =
        SqlRecordMode.parse(
            configProvider.getString(TRACE_SQL_RECORD, DEFAULT_TRACE_SQL_RECORD),
            SqlRecordMode.OBFUSCATED);
    traceStrictMode = configProvider.getBoolean(TRACE_STRICT_MODE, DEFAULT_TRACE_STRICT_MODE);
    traceSourceCodeContextEnabled =
        configProvider.getBoolean(
            TRACE_SOURCE_CODE_CONTEXT_ENABLED, DEFAULT_TRACE_SOURCE_CODE_CONTEXT_ENABLED);

    datastoreInstanceReportingEnabled =
        configProvider.getBoolean(
            DATASTORE_INSTANCE_REPORTING_ENABLED, DEFAULT_DATASTORE_INSTANCE_REPORTING_ENABLED);
    datastoreDatabaseNameReportingEnabled =
        configProvider.getBoolean(
            DATASTORE_DATABASE_NAME_REPORTING_ENABLED,
            DEFAULT_DATASTORE_DATABASE_NAME_REPORTING_ENABLED);

    distributedTracingEnabled =
        configProvider.getBoolean(DISTRIBUTED_TRACING_ENABLED, DEFAULT_DISTRIBUTED_TRACING_ENABLED);
    crossApplicationTracerEnabled =
        configProvider.getBoolean(
            CROSS_APPLICATION_TRACER_ENABLED, DEFAULT_CROSS_APPLICATION_TRACER_ENABLED);
    accountId = configProvider.getString(ACCOUNT_ID);
    primaryApplicationId = configProvider.getString(PRIMARY_APPLICATION_ID);
    // the trust key defaults to the account id when it is not explicitly set
    trustedAccountKey = configProvider.getString(TRUSTED_ACCOUNT_KEY, accountId);
    trustedAccountIds = configProvider.getSet(TRUSTED_ACCOUNT_IDS, null);
    crossProcessId = configProvider.getString(CROSS_PROCESS_ID);
    encodingKey = configProvider.getString(ENCODING_KEY);

    samplingTarget =
        atLeast(
            SAMPLING_TARGET,
            configProvider.getInteger(SAMPLING_TARGET, DEFAULT_SAMPLING_TARGET),
            0,
            DEFAULT_SAMPLING_TARGET);
    samplingIntervalSeconds =
        atLeast(
            SAMPLING_INTERVAL,
            configProvider.getInteger(SAMPLING_INTERVAL, DEFAULT_SAMPLING_INTERVAL_SECONDS),
            1,
            DEFAULT_SAMPLING_INTERVAL_SECONDS);

    metricsReportingIntervalSeconds =
        atLeast(
            METRICS_REPORTING_INTERVAL,
            configProvider.getInteger(
                METRICS_REPORTING_INTERVAL, DEFAULT_METRICS_REPORTING_INTERVAL_SECONDS),
            1,
            DEFAULT_METRICS_REPORTING_INTERVAL_SECONDS);

    errorCollectorIgnoreClasses = configProvider.getSet(ERROR_COLLECTOR_IGNORE_CLASSES, null);
    errorCollectorMax =
        atLeast(
            ERROR_COLLECTOR_MAX,
            configProvider.getInteger(ERROR_COLLECTOR_MAX, DEFAULT_ERROR_COLLECTOR_MAX),
            0,
            DEFAULT_ERROR_COLLECTOR_MAX);
  }

  private static int atLeast(String key, int value, int min, int defaultValue) {
    if (value < min) {
      log.warn(
          "Invalid configuration for {}: {} is below {}, using {}", key, value, min, defaultValue);
      return defaultValue;
    }
    return value;
  }

  private static long atLeast(String key, long value, long min, long defaultValue) {
    if (value < min) {
      log.warn(
          "Invalid configuration for {}: {} is below {}, using {}", key, value, min, defaultValue);
      return defaultValue;
    }
    return value;
  }

  private static Set<String> lowerCase(Set<String> values) {
    Set<String> result = new HashSet<>(values.size() * 2);
    for (String value : values) {
      result.add(value.toLowerCase(Locale.ROOT));
    }
    return Collections.unmodifiableSet(result);
  }

  public String getAppName() {
    return appName;
  }

  public int getTraceMaxDepth() {
    return traceMaxDepth;
  }

  public int getTraceMaxSpans() {
    return traceMaxSpans;
  }

  public long getTraceSegmentThresholdNanos() {
    return MILLISECONDS.toNanos(traceSegmentThresholdMs);
  }

  public long getTraceStackTraceThresholdNanos() {
    return MILLISECONDS.toNanos(traceStackTraceThresholdMs);
  }

  public int getTraceStackTraceMaxFrames() {
    return traceStackTraceMaxFrames;
  }

  public boolean isTraceExplainEnabled() {
    return traceExplainEnabled;
  }

  public long getTraceExplainThresholdNanos() {
    return MILLISECONDS.toNanos(traceExplainThresholdMs);
  }

  public long getTraceExplainTimeoutMillis() {
    return traceExplainTimeoutMs;
  }

  public Set<String> getTraceExplainVerbs() {
    return traceExplainVerbs;
  }

  public SqlRecordMode getTraceSqlRecordMode() {
    return traceSqlRecordMode;
  }

  public boolean isTraceStrictMode() {
    return traceStrictMode;
  }

  public boolean isTraceSourceCodeContextEnabled() {
    return traceSourceCodeContextEnabled;
  }

  public boolean isDatastoreInstanceReportingEnabled() {
    return datastoreInstanceReportingEnabled;
  }

  public boolean isDatastoreDatabaseNameReportingEnabled() {
    return datastoreDatabaseNameReportingEnabled;
  }

  public boolean isDistributedTracingEnabled() {
    return distributedTracingEnabled;
  }

  public boolean isCrossApplicationTracerEnabled() {
    return crossApplicationTracerEnabled;
  }

  public String getAccountId() {
    return accountId;
  }

  public String getPrimaryApplicationId() {
    return primaryApplicationId;
  }

  public String getTrustedAccountKey() {
    return trustedAccountKey;
  }

  public Set<String> getTrustedAccountIds() {
    return trustedAccountIds;
  }

  public String getCrossProcessId() {
    return crossProcessId;
  }

  public String getEncodingKey() {
    return encodingKey;
  }

  public int getSamplingTarget() {
    return samplingTarget;
  }

  public int getSamplingIntervalSeconds() {
    return samplingIntervalSeconds;
  }

  public int getMetricsReportingIntervalSeconds() {
    return metricsReportingIntervalSeconds;
  }

  public Set<String> getErrorCollectorIgnoreClasses() {
    return errorCollectorIgnoreClasses;
  }

  public int getErrorCollectorMax() {
    return errorCollectorMax;
  }

  // This has to be placed after all other static fields to give them a chance to initialize
  private static final Config INSTANCE = new Config(ConfigProvider.createDefault());

  public static Config get() {
    return INSTANCE;
  }

  public static Config from(ConfigProvider configProvider) {
    return new Config(configProvider);
  }

  /** Settings from the map only; system properties and environment are ignored. */
  public static Config from(Map<String, String> settings) {
    return new Config(ConfigProvider.of(settings));
  }

  @Override
  public String toString() {
    return "Config{"
        + "appName='"
        + appName
        + '\''
        + ", traceMaxDepth="
        + traceMaxDepth
        + ", traceMaxSpans="
        + traceMaxSpans
        + ", traceSegmentThresholdMs="
        + traceSegmentThresholdMs
        + ", traceStackTraceThresholdMs="
        + traceStackTraceThresholdMs
        + ", traceExplainEnabled="
        + traceExplainEnabled
        + ", traceExplainThresholdMs="
        + traceExplainThresholdMs
        + ", traceSqlRecordMode="
        + traceSqlRecordMode
        + ", distributedTracingEnabled="
        + distributedTracingEnabled
        + ", crossApplicationTracerEnabled="
        + crossApplicationTracerEnabled
        + ", samplingTarget="
        + samplingTarget
        + '}';
  }
}
