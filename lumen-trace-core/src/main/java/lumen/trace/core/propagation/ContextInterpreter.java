package lumen.trace.core.propagation;

import java.util.Locale;

/**
 * Collects the headers of one format while a carrier is visited and builds the resulting {@link
 * TraceContext}. Instances are reused per thread; when adding new fields remember to clear them in
 * {@link #reset()}.
 */
public abstract class ContextInterpreter implements KeyClassifier {

  protected TraceContext.Builder builder;
  protected boolean valid;
  protected boolean seen;

  protected static String toLowerCase(String key) {
    return key.toLowerCase(Locale.ROOT);
  }

  public ContextInterpreter reset() {
    builder = TraceContext.builder();
    valid = true;
    seen = false;
    return this;
  }

  /**
   * Whether a distributed trace payload of this format was present, valid or not. Legacy formats
   * do not count.
   */
  protected boolean sawPayload() {
    return seen;
  }

  protected TraceContext build() {
    if (valid && seen) {
      return complete();
    }
    return null;
  }

  /** Called once every key was visited; may still reject the context by returning null. */
  protected abstract TraceContext complete();

  protected void invalidateContext() {
    this.valid = false;
  }

  public interface Factory {
    ContextInterpreter create();
  }
}
