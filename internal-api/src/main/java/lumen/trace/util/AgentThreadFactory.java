package lumen.trace.util;

import java.util.concurrent.ThreadFactory;
import org.slf4j.LoggerFactory;

/** A {@link ThreadFactory} implementation that starts all tracer {@link Thread}s as daemons. */
public final class AgentThreadFactory implements ThreadFactory {
  public static final ThreadGroup AGENT_THREAD_GROUP = new ThreadGroup("lumen-trace-java");

  public static final long THREAD_JOIN_TIMOUT_MS = 800;

  // known tracer threads
  public enum AgentThread {
    METRICS_AGGREGATOR("lumen-metrics-aggregator"),
    METRICS_REPORTER("lumen-metrics-reporter"),
    EXPLAIN_PLAN("lumen-explain-plan");

    public final String threadName;

    AgentThread(final String threadName) {
      this.threadName = threadName;
    }
  }

  private final AgentThread agentThread;

  /**
   * Constructs a new tracer {@code ThreadFactory}.
   *
   * @param agentThread the tracer thread created by this factory.
   */
  public AgentThreadFactory(final AgentThread agentThread) {
    this.agentThread = agentThread;
  }

  @Override
  public Thread newThread(final Runnable runnable) {
    return newAgentThread(agentThread, runnable);
  }

  /**
   * Constructs a new tracer {@code Thread} as a daemon with a null ContextClassLoader.
   *
   * @param agentThread the tracer thread to create.
   * @param runnable work to run on the new thread.
   */
  public static Thread newAgentThread(final AgentThread agentThread, final Runnable runnable) {
    final Thread thread = new Thread(AGENT_THREAD_GROUP, runnable, agentThread.threadName);
    thread.setDaemon(true);
    thread.setContextClassLoader(null);
    thread.setUncaughtExceptionHandler(
        new Thread.UncaughtExceptionHandler() {
          @Override
          public void uncaughtException(final Thread thread, final Throwable e) {
            LoggerFactory.getLogger(runnable.getClass())
                .error("Uncaught exception {} in {}", e, agentThread.threadName, e);
          }
        });
    return thread;
  }
}
