package lumen.trace.core;

import java.util.Set;
import lumen.trace.api.Config;

/**
 * Decides which closed spans get a stack snapshot and which database spans get an explain plan
 * request. Thresholds of zero mean "always".
 */
final class EnrichmentPolicy {

  private final long stackTraceThresholdNanos;
  private final boolean explainEnabled;
  private final long explainThresholdNanos;
  private final Set<String> explainVerbs;

  EnrichmentPolicy(Config config) {
    this.stackTraceThresholdNanos = config.getTraceStackTraceThresholdNanos();
    this.explainEnabled = config.isTraceExplainEnabled();
    this.explainThresholdNanos = config.getTraceExplainThresholdNanos();
    this.explainVerbs = config.getTraceExplainVerbs();
  }

  boolean shouldCaptureStackTrace(long inclusiveNanos) {
    return inclusiveNanos >= stackTraceThresholdNanos;
  }

  /**
   * SQL database spans only; other datastores have no query planner. The verb check is on the
   * leading keyword only, so DDL and garbage never qualify.
   */
  boolean shouldRequestExplain(SpanKind kind, String sql, long inclusiveNanos) {
    return explainEnabled
        && kind == SpanKind.DATABASE
        && sql != null
        && inclusiveNanos >= explainThresholdNanos
        && explainVerbs.contains(SqlStatements.leadingVerb(sql));
  }
}
