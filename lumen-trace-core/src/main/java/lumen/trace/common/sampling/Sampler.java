package lumen.trace.common.sampling;

public interface Sampler {

  /**
   * Provides binary answer whether the current transaction is to be sampled
   *
   * @return {@literal true} if the transaction should be sampled
   */
  boolean sample();

  /**
   * Force the sampling decision to keep this transaction
   *
   * @return always {@literal true}
   */
  boolean keep();

  /**
   * Force the sampling decision to drop this transaction
   *
   * @return always {@literal false}
   */
  boolean drop();

  /** Samples and attaches a fresh priority to the outcome. */
  default SamplingDecision decide() {
    return SamplingDecision.of(sample());
  }
}
