package lumen.trace.core;

import static lumen.trace.core.MetricNames.UNKNOWN;

import lumen.trace.api.Config;

/**
 * Derives the {@code peer.*} and {@code db.instance} attributes of a datastore span from the
 * {@code server.*} and {@code db.name} attributes set by instrumentation. Parts that are missing,
 * or that reporting is switched off for, read {@code Unknown}.
 */
final class DatastoreAttributes {
  private DatastoreAttributes() {}

  static void apply(Span span, Config config) {
    String host = null;
    String port = null;
    if (config.isDatastoreInstanceReportingEnabled()) {
      host = span.getStringAttribute(SpanAttributes.SERVER_ADDRESS);
      port = span.getStringAttribute(SpanAttributes.SERVER_PORT);
    }
    span.setAttribute(SpanAttributes.PEER_HOSTNAME, orUnknown(host));
    span.setAttribute(SpanAttributes.PEER_ADDRESS, orUnknown(host) + ':' + orUnknown(port));

    // SQL databases always report an instance; other stores only when they name one
    String database = span.getStringAttribute(SpanAttributes.DB_NAME);
    if (span.kind == SpanKind.DATABASE || database != null) {
      span.setAttribute(
          SpanAttributes.DB_INSTANCE,
          config.isDatastoreDatabaseNameReportingEnabled() ? orUnknown(database) : UNKNOWN);
    }
  }

  private static String orUnknown(String value) {
    return value == null || value.trim().isEmpty() ? UNKNOWN : value.trim();
  }
}
