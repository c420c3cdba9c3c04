package lumen.trace.common.sampling;

/** Samples everything. */
public class AllSampler implements Sampler {

  @Override
  public boolean sample() {
    return true;
  }

  @Override
  public boolean keep() {
    return true;
  }

  @Override
  public boolean drop() {
    return false;
  }

  @Override
  public String toString() {
    return "AllSampler";
  }
}
