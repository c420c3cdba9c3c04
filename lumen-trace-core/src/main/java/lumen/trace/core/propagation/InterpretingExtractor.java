package lumen.trace.core.propagation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs a thread-local {@link ContextInterpreter} over every key of the carrier. */
public class InterpretingExtractor implements HttpCodec.Extractor {

  private static final Logger log = LoggerFactory.getLogger(InterpretingExtractor.class);

  private final ThreadLocal<ContextInterpreter> ctxInterpreter;

  public InterpretingExtractor(final ContextInterpreter.Factory factory) {
    this.ctxInterpreter = ThreadLocal.withInitial(factory::create);
  }

  @Override
  public <C> TraceContext extract(final C carrier, final CarrierVisitor<C> getter) {
    ContextInterpreter interpreter = this.ctxInterpreter.get().reset();
    try {
      getter.forEachKey(carrier, interpreter);
      return interpreter.build();
    } catch (RuntimeException e) {
      log.debug("Unable to extract context", e);
      return null;
    }
  }

  @Override
  public <C> boolean hasPayload(final C carrier, final CarrierVisitor<C> getter) {
    ContextInterpreter interpreter = this.ctxInterpreter.get().reset();
    try {
      getter.forEachKey(carrier, interpreter);
      return interpreter.sawPayload();
    } catch (RuntimeException e) {
      return true;
    }
  }

  @Override
  public void cleanup() {
    ctxInterpreter.remove();
  }
}
