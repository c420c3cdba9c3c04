package lumen.trace.api;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strategy for generating trace, span and transaction identifiers. Identifiers are lower-case hex
 * strings: 32 characters for trace ids, 16 for everything else.
 */
public abstract class IdGenerationStrategy {

  public static IdGenerationStrategy fromName(String name) {
    switch (name.toUpperCase()) {
      case "RANDOM":
        return new Random();
      case "SEQUENTIAL":
        return new Sequential();
      default:
        throw new IllegalArgumentException("Unknown id generation strategy " + name);
    }
  }

  /** A non-zero 64 bit value. */
  protected abstract long nextId();

  public String generateSpanId() {
    return HexIds.toHexStringPadded(nextId(), 16);
  }

  public String generateGuid() {
    return HexIds.toHexStringPadded(nextId(), 16);
  }

  public String generateTraceId() {
    return HexIds.toHexStringPadded(nextId(), 16) + HexIds.toHexStringPadded(nextId(), 16);
  }

  static final class Random extends IdGenerationStrategy {
    @Override
    protected long nextId() {
      long id;
      do {
        id = ThreadLocalRandom.current().nextLong();
      } while (id == 0);
      return id;
    }
  }

  static final class Sequential extends IdGenerationStrategy {
    private final AtomicLong id = new AtomicLong(0);

    @Override
    protected long nextId() {
      return id.incrementAndGet();
    }
  }
}
