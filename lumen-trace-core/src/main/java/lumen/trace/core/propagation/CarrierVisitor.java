package lumen.trace.core.propagation;

@FunctionalInterface
public interface CarrierVisitor<C> {
  void forEachKey(C carrier, KeyClassifier classifier);
}
