package lumen.trace.common.metrics;

import java.util.Objects;

/**
 * Identifies a metric time series. Unscoped metrics have an empty scope; scoped metrics carry the
 * metric name of the transaction they were recorded under.
 */
public final class MetricKey {
  private final String name;
  private final String scope;
  private final int hash;

  public MetricKey(String name, String scope) {
    this.name = null == name ? "" : name;
    this.scope = null == scope ? "" : scope;
    this.hash = 31 * this.name.hashCode() + this.scope.hashCode();
  }

  public static MetricKey unscoped(String name) {
    return new MetricKey(name, "");
  }

  public String getName() {
    return name;
  }

  public String getScope() {
    return scope;
  }

  public boolean isScoped() {
    return !scope.isEmpty();
  }

  MetricKey withScope(String newScope) {
    return new MetricKey(name, newScope);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if ((o instanceof MetricKey)) {
      MetricKey metricKey = (MetricKey) o;
      return hash == metricKey.hash
          && name.equals(metricKey.name)
          && Objects.equals(scope, metricKey.scope);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return scope.isEmpty() ? name : name + " [" + scope + "]";
  }
}
