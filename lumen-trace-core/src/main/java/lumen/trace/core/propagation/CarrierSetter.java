package lumen.trace.core.propagation;

@FunctionalInterface
public interface CarrierSetter<C> {
  void set(C carrier, String key, String value);
}
