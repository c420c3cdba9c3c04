package lumen.trace.core.propagation;

import java.util.Map;

/** Setter and visitor for header maps. */
public final class Carriers {
  private Carriers() {}

  public static final CarrierSetter<Map<String, String>> MAP_SETTER = Map::put;

  public static final CarrierVisitor<Map<String, String>> MAP_VISITOR =
      (carrier, classifier) -> {
        for (Map.Entry<String, String> entry : carrier.entrySet()) {
          if (!classifier.accept(entry.getKey(), entry.getValue())) {
            return;
          }
        }
      };
}
