package lumen.trace.common.sampling;

import java.util.concurrent.ThreadLocalRandom;

/** Sampled flag plus priority; sampled transactions always carry a priority of at least 1. */
public final class SamplingDecision {
  private final boolean sampled;
  private final float priority;

  public SamplingDecision(boolean sampled, float priority) {
    this.sampled = sampled;
    this.priority = priority;
  }

  /** Random priority in [0, 1) rounded to six decimals, raised by one when sampled. */
  public static SamplingDecision of(boolean sampled) {
    float priority = round6(ThreadLocalRandom.current().nextFloat());
    return new SamplingDecision(sampled, sampled ? priority + 1 : priority);
  }

  static float round6(float value) {
    return Math.round(value * 1_000_000d) / 1_000_000f;
  }

  public boolean isSampled() {
    return sampled;
  }

  public float getPriority() {
    return priority;
  }

  @Override
  public String toString() {
    return "SamplingDecision{sampled=" + sampled + ", priority=" + priority + '}';
  }
}
