package lumen.trace.core;

/**
 * Runs an explain plan on behalf of the tracer, typically against the connection the statement
 * was executed on. Called off the application thread and abandoned after the configured timeout.
 */
@FunctionalInterface
public interface ExplainPlanProvider {
  /** @return the plan rendered as text, or {@code null} when none is available */
  String explain(ExplainPlanRequest request) throws Exception;
}
