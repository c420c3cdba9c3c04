package lumen.trace.core;

import java.util.Map;

/** What an {@link ExplainPlanProvider} needs to explain one statement. */
public final class ExplainPlanRequest {
  private final String spanId;
  private final String product;
  private final String sql;
  private final Map<String, Object> attributes;

  ExplainPlanRequest(String spanId, String product, String sql, Map<String, Object> attributes) {
    this.spanId = spanId;
    this.product = product;
    this.sql = sql;
    this.attributes = attributes;
  }

  public String getSpanId() {
    return spanId;
  }

  /** Value of the {@code db.system} attribute, or {@code null}. */
  public String getProduct() {
    return product;
  }

  /** The statement as executed, literals included. */
  public String getSql() {
    return sql;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @Override
  public String toString() {
    return "ExplainPlanRequest{spanId=" + spanId + ", product=" + product + '}';
  }
}
