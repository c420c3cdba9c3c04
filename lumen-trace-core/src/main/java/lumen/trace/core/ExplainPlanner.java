package lumen.trace.core;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static lumen.trace.util.AgentThreadFactory.AgentThread.EXPLAIN_PLAN;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeoutException;
import lumen.trace.api.RatelimitedLogger;
import lumen.trace.util.AgentThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs explain plan requests on a daemon thread, waiting at most the configured timeout. */
final class ExplainPlanner implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ExplainPlanner.class);
  private static final int MAX_PENDING = 32;

  private final ExplainPlanProvider provider;
  private final long timeoutMillis;
  private final ThreadPoolExecutor executor;
  private final RatelimitedLogger rlLog;

  ExplainPlanner(ExplainPlanProvider provider, long timeoutMillis) {
    this.provider = provider;
    this.timeoutMillis = timeoutMillis;
    this.executor =
        new ThreadPoolExecutor(
            1,
            1,
            0,
            MILLISECONDS,
            new ArrayBlockingQueue<Runnable>(MAX_PENDING),
            new AgentThreadFactory(EXPLAIN_PLAN));
    this.rlLog = new RatelimitedLogger(log, 5, MINUTES);
  }

  /** @return the plan, or {@code null} when the provider failed, timed out or was saturated */
  String explain(ExplainPlanRequest request) {
    Future<String> future;
    try {
      future = executor.submit(() -> provider.explain(request));
    } catch (RejectedExecutionException e) {
      rlLog.warn("Explain plan skipped for {}: too many pending requests", request);
      return null;
    }
    try {
      return future.get(timeoutMillis, MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      rlLog.warn("Explain plan for {} timed out after {} ms", request, timeoutMillis);
    } catch (ExecutionException e) {
      rlLog.warn("Explain plan for {} failed: {}", request, String.valueOf(e.getCause()));
      if (log.isDebugEnabled()) {
        log.debug("Explain plan failure", e.getCause());
      }
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
    }
    return null;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
