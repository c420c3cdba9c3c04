package lumen.trace.core.propagation;

import java.util.ArrayList;
import java.util.List;
import lumen.trace.api.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HttpCodec {

  private static final Logger log = LoggerFactory.getLogger(HttpCodec.class);

  public interface Injector {
    <C> void inject(final TraceContext context, final C carrier, final CarrierSetter<C> setter);
  }

  /** This interface defines propagated context extractor. */
  public interface Extractor {
    /**
     * Extracts a propagated context from the given carrier using the provided getter.
     *
     * @param carrier The carrier containing the propagated context.
     * @param getter The getter used to visit the carrier.
     * @param <C> The type of the carrier.
     * @return {@code null} when the headers are missing, malformed, of an unsupported version or
     *     from an untrusted account.
     */
    <C> TraceContext extract(final C carrier, final CarrierVisitor<C> getter);

    /** Whether the carrier holds a distributed trace payload of this format, valid or not. */
    default <C> boolean hasPayload(final C carrier, final CarrierVisitor<C> getter) {
      return false;
    }

    /**
     * Cleans up any thread local resources associated with this extractor.
     *
     * <p><i>Currently only used from tests.</i>
     */
    default void cleanup() {}
  }

  /**
   * W3C trace context plus the {@code newrelic} payload when distributed tracing is enabled;
   * otherwise the legacy headers when cross application tracing is enabled; otherwise nothing.
   */
  public static Injector createInjector(Config config) {
    List<Injector> injectors = new ArrayList<>(2);
    if (config.isDistributedTracingEnabled()) {
      injectors.add(W3CHttpCodec.newInjector());
      injectors.add(NewRelicHttpCodec.newInjector());
    } else if (config.isCrossApplicationTracerEnabled()) {
      injectors.add(CatHttpCodec.newInjector(config));
    }
    switch (injectors.size()) {
      case 0:
        return NoopInjector.INSTANCE;
      case 1:
        return injectors.get(0);
      default:
        return new CompoundInjector(injectors);
    }
  }

  /** Extractors in precedence order: traceparent, then newrelic, then legacy headers. */
  public static Extractor createExtractor(Config config) {
    final List<Extractor> extractors = new ArrayList<>(3);
    if (config.isDistributedTracingEnabled()) {
      extractors.add(W3CHttpCodec.newExtractor(config));
      extractors.add(NewRelicHttpCodec.newExtractor(config));
    }
    if (config.isCrossApplicationTracerEnabled()) {
      extractors.add(CatHttpCodec.newExtractor(config));
    }
    switch (extractors.size()) {
      case 0:
        return StubExtractor.INSTANCE;
      case 1:
        return extractors.get(0);
      default:
        return new CompoundExtractor(extractors);
    }
  }

  public static class CompoundInjector implements Injector {

    private final List<Injector> injectors;

    public CompoundInjector(final List<Injector> injectors) {
      this.injectors = injectors;
    }

    @Override
    public <C> void inject(
        final TraceContext context, final C carrier, final CarrierSetter<C> setter) {
      log.debug("Inject context {}", context);
      for (final Injector injector : injectors) {
        injector.inject(context, carrier, setter);
      }
    }
  }

  static final class NoopInjector implements Injector {
    static final NoopInjector INSTANCE = new NoopInjector();

    @Override
    public <C> void inject(TraceContext context, C carrier, CarrierSetter<C> setter) {}
  }

  private static class StubExtractor implements Extractor {
    private static final StubExtractor INSTANCE = new StubExtractor();

    @Override
    public <C> TraceContext extract(C carrier, CarrierVisitor<C> getter) {
      return null;
    }
  }

  /**
   * The first extractor yielding a trace id supplies the identifiers; legacy fields found by any
   * later extractor are kept on the result.
   */
  public static class CompoundExtractor implements Extractor {
    private final List<Extractor> extractors;

    public CompoundExtractor(final List<Extractor> extractors) {
      this.extractors = extractors;
    }

    @Override
    public <C> TraceContext extract(final C carrier, final CarrierVisitor<C> getter) {
      TraceContext context = null;
      CatContext catContext = null;
      for (final Extractor extractor : this.extractors) {
        TraceContext extracted = extractor.extract(carrier, getter);
        if (extracted == null) {
          continue;
        }
        if (context == null && extracted.hasTraceId()) {
          context = extracted;
        }
        if (catContext == null && extracted.getCatContext() != null) {
          catContext = extracted.getCatContext();
        }
      }
      if (context != null) {
        if (catContext != null && context.getCatContext() == null) {
          context = context.toBuilder().catContext(catContext).build();
        }
        log.debug("Extract complete context {}", context);
        return context;
      } else if (catContext != null) {
        log.debug("Extract legacy context {}", catContext);
        return TraceContext.builder().catContext(catContext).build();
      }
      log.debug("Extract no context");
      return null;
    }

    @Override
    public <C> boolean hasPayload(final C carrier, final CarrierVisitor<C> getter) {
      for (final Extractor extractor : this.extractors) {
        if (extractor.hasPayload(carrier, getter)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public void cleanup() {
      for (final Extractor extractor : this.extractors) {
        extractor.cleanup();
      }
    }
  }
}
