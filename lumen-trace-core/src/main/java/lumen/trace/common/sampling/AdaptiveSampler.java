package lumen.trace.common.sampling;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import lumen.trace.api.time.TimeSource;

/**
 * An adaptive streaming (non-remembering) sampler.
 *
 * <p>The sampler attempts to keep at most N transactions per fixed time window in randomized
 * fashion. In the first window the first N transactions are sampled. At each window roll the
 * observed number of transactions is folded into a running average and used to recompute the
 * probability for the next window, so samples are spread through the window instead of being
 * spent on its first N transactions.
 *
 * <p>Windows are rolled lazily by the first {@link #sample()} call past the window end; there is
 * no background task.
 */
public class AdaptiveSampler implements Sampler {

  private static final class Counts {
    private final LongAdder testCount = new LongAdder();
    private static final AtomicLongFieldUpdater<Counts> SAMPLE_COUNT =
        AtomicLongFieldUpdater.newUpdater(Counts.class, "sampleCount");
    private volatile long sampleCount = 0L;

    void addTest() {
      testCount.increment();
    }

    boolean addSample(final long limit) {
      return SAMPLE_COUNT.getAndAccumulate(this, limit, (prev, lim) -> Math.min(prev + 1, lim))
          < limit;
    }

    void addSample() {
      SAMPLE_COUNT.incrementAndGet(this);
    }

    long sampleCount() {
      return SAMPLE_COUNT.get(this);
    }

    long testCount() {
      return testCount.sum();
    }
  }

  private static final int AVERAGE_LOOKBACK = 16;

  private final int samplesPerWindow;
  private final long windowNanos;
  private final double emaAlpha;
  private final TimeSource timeSource;

  private final AtomicReference<Counts> countsRef = new AtomicReference<>(new Counts());
  private final AtomicLong windowEndTicks;

  private volatile double probability = 1d;
  // only touched by the thread that won the roll
  private double totalCountRunningAverage = 0d;

  /**
   * @param samplesPerWindow the maximum number of samples in the sampling window
   * @param window the sampling window duration
   * @param unit unit of {@code window}
   * @param timeSource clock driving window rolls
   */
  public AdaptiveSampler(
      final int samplesPerWindow, final long window, final TimeUnit unit, TimeSource timeSource) {
    if (window <= 0) {
      throw new IllegalArgumentException("'window' argument must be positive");
    }
    this.samplesPerWindow = samplesPerWindow;
    this.windowNanos = unit.toNanos(window);
    this.emaAlpha = computeIntervalAlpha(AVERAGE_LOOKBACK);
    this.timeSource = timeSource;
    this.windowEndTicks = new AtomicLong(timeSource.getNanoTicks() + windowNanos);
  }

  @Override
  public boolean sample() {
    maybeRollWindow();
    final Counts counts = countsRef.get();
    counts.addTest();
    if (ThreadLocalRandom.current().nextDouble() < probability) {
      return counts.addSample(samplesPerWindow);
    }
    return false;
  }

  @Override
  public boolean keep() {
    maybeRollWindow();
    final Counts counts = countsRef.get();
    counts.addTest();
    counts.addSample();
    return true;
  }

  @Override
  public boolean drop() {
    maybeRollWindow();
    countsRef.get().addTest();
    return false;
  }

  private void maybeRollWindow() {
    long now = timeSource.getNanoTicks();
    long end = windowEndTicks.get();
    if (now < end) {
      return;
    }
    // skip windows in which nothing arrived so idle periods do not distort the average
    long nextEnd = end + ((now - end) / windowNanos + 1) * windowNanos;
    if (windowEndTicks.compareAndSet(end, nextEnd)) {
      rollWindow();
    }
  }

  private void rollWindow() {
    final Counts counts = countsRef.getAndSet(new Counts());
    final long totalCount = counts.testCount();
    if (totalCountRunningAverage == 0 || emaAlpha <= 0.0d) {
      totalCountRunningAverage = totalCount;
    } else {
      totalCountRunningAverage =
          totalCountRunningAverage + emaAlpha * (totalCount - totalCountRunningAverage);
    }
    if (totalCountRunningAverage <= 0) {
      probability = 1;
    } else {
      probability = Math.min(samplesPerWindow / totalCountRunningAverage, 1d);
    }
  }

  private static double computeIntervalAlpha(final int lookback) {
    return 1 - Math.pow(lookback, -1d / lookback);
  }

  // access for tests
  long testCount() {
    return countsRef.get().testCount();
  }

  long sampleCount() {
    return countsRef.get().sampleCount();
  }

  double probability() {
    return probability;
  }
}
