package lumen.trace.core.propagation;

@FunctionalInterface
public interface KeyClassifier {
  /** @return false to stop visiting further keys */
  boolean accept(String key, String value);
}
