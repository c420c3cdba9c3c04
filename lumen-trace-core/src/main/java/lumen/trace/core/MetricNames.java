package lumen.trace.core;

import static lumen.trace.core.SpanAttributes.CAT_CROSS_PROCESS_ID;
import static lumen.trace.core.SpanAttributes.CAT_TRANSACTION_NAME;
import static lumen.trace.core.SpanAttributes.COMPONENT;
import static lumen.trace.core.SpanAttributes.DB_COLLECTION;
import static lumen.trace.core.SpanAttributes.DB_OPERATION;
import static lumen.trace.core.SpanAttributes.DB_SYSTEM;
import static lumen.trace.core.SpanAttributes.HTTP_METHOD;
import static lumen.trace.core.SpanAttributes.HTTP_URL;
import static lumen.trace.core.SpanAttributes.MESSAGING_DESTINATION;
import static lumen.trace.core.SpanAttributes.MESSAGING_DESTINATION_KIND;
import static lumen.trace.core.SpanAttributes.MESSAGING_OPERATION;
import static lumen.trace.core.SpanAttributes.MESSAGING_SYSTEM;
import static lumen.trace.core.SpanAttributes.MESSAGING_TEMPORARY;
import static lumen.trace.core.SpanAttributes.SERVER_ADDRESS;
import static lumen.trace.core.SpanAttributes.SERVER_PORT;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives metric names from span kind and attributes. Names depend only on their inputs, so
 * repeated spans with the same attributes always land on the same series.
 */
public final class MetricNames {

  public static final String UNKNOWN = "Unknown";

  public static final String WEB_TRANSACTION = "WebTransaction";
  public static final String OTHER_TRANSACTION = "OtherTransaction";
  public static final String OTHER_TRANSACTION_ALL = "OtherTransaction/all";
  public static final String WEB_TRANSACTION_TOTAL_TIME = "WebTransactionTotalTime";
  public static final String OTHER_TRANSACTION_TOTAL_TIME = "OtherTransactionTotalTime";

  public static final String ERRORS_ALL = "Errors/all";
  public static final String ERRORS_ALL_WEB = "Errors/allWeb";
  public static final String ERRORS_ALL_OTHER = "Errors/allOther";

  public static final String DATASTORE_ALL = "Datastore/all";
  public static final String EXTERNAL_ALL = "External/all";

  public static final String DEPTH_LIMIT_EXCEEDED = "Supportability/Trace/DepthLimitExceeded";
  public static final String SPAN_LIMIT_EXCEEDED = "Supportability/Trace/SpanLimitExceeded";
  public static final String ORPHANED_SPAN = "Supportability/Trace/OrphanedSpan";

  public static final String ACCEPT_PAYLOAD_SUCCESS =
      "Supportability/DistributedTrace/AcceptPayload/Success";
  public static final String ACCEPT_PAYLOAD_IGNORED_NULL =
      "Supportability/DistributedTrace/AcceptPayload/Ignored/Null";
  public static final String ACCEPT_PAYLOAD_PARSE_EXCEPTION =
      "Supportability/DistributedTrace/AcceptPayload/ParseException";

  private MetricNames() {}

  /** The names a closed span contributes to. */
  static final class SpanMetrics {
    /** Recorded both scoped to the transaction and unscoped. */
    final String scoped;
    /** Unscoped rollups that do not depend on the web flag. */
    final Set<String> rollups;
    /** Prefixes completed with {@code allWeb} or {@code allOther} when the transaction ends. */
    final List<String> webRollupPrefixes;

    SpanMetrics(String scoped, Set<String> rollups, List<String> webRollupPrefixes) {
      this.scoped = scoped;
      this.rollups = rollups;
      this.webRollupPrefixes = webRollupPrefixes;
    }
  }

  public static String transactionMetricName(String name, boolean web) {
    return (web ? WEB_TRANSACTION : OTHER_TRANSACTION) + '/' + segment(stripSlashes(name));
  }

  static String totalTimeMetricName(String transactionName, boolean web) {
    return (web ? WEB_TRANSACTION_TOTAL_TIME : OTHER_TRANSACTION_TOTAL_TIME)
        + '/'
        + segment(stripSlashes(transactionName));
  }

  static String errorsMetricName(String transactionMetricName) {
    return "Errors/" + transactionMetricName;
  }

  static String webSuffix(boolean web) {
    return web ? "allWeb" : "allOther";
  }

  static SpanMetrics forSpan(Span span) {
    return forSpan(span, true);
  }

  /** With {@code instanceReporting} off no {@code Datastore/instance/...} rollup is produced. */
  static SpanMetrics forSpan(Span span, boolean instanceReporting) {
    switch (span.kind) {
      case DATABASE:
      case DATASTORE:
        return datastore(span, instanceReporting);
      case EXTERNAL:
        return external(span);
      case MESSAGE:
        return simple(messageBroker(span));
      case CUSTOM:
        return simple("Custom/" + segment(span.name));
      case FUNCTION:
      default:
        return simple("Function/" + segment(span.name));
    }
  }

  private static SpanMetrics simple(String name) {
    return new SpanMetrics(name, Collections.<String>emptySet(), Collections.<String>emptyList());
  }

  private static SpanMetrics datastore(Span span, boolean instanceReporting) {
    String product = segment(span.getStringAttribute(DB_SYSTEM));
    String operation;
    String table;
    if (span.kind == SpanKind.DATABASE) {
      String sql = span.getRawSql() != null ? span.getRawSql() : span.name;
      SqlStatements.Statement statement = SqlStatements.parse(sql);
      operation = statement.operation;
      table = statement.table;
    } else {
      String op = span.getStringAttribute(DB_OPERATION);
      operation = lower(op != null ? op : span.name);
      table = span.getStringAttribute(DB_COLLECTION);
    }
    String operationMetric = "Datastore/operation/" + product + '/' + segment(operation);
    String scoped =
        table != null
            ? "Datastore/statement/" + product + '/' + segment(table) + '/' + segment(operation)
            : operationMetric;

    Set<String> rollups = new LinkedHashSet<>();
    rollups.add(DATASTORE_ALL);
    rollups.add("Datastore/" + product + "/all");
    if (!operationMetric.equals(scoped)) {
      rollups.add(operationMetric);
    }
    String host = instanceReporting ? span.getStringAttribute(SERVER_ADDRESS) : null;
    if (host != null) {
      String port = span.getStringAttribute(SERVER_PORT);
      rollups.add(
          "Datastore/instance/" + product + '/' + segment(host) + '/' + segment(port));
    }
    List<String> webPrefixes = new ArrayList<>(2);
    webPrefixes.add("Datastore/");
    webPrefixes.add("Datastore/" + product + '/');
    return new SpanMetrics(scoped, rollups, webPrefixes);
  }

  private static SpanMetrics external(Span span) {
    String host = span.getStringAttribute(SERVER_ADDRESS);
    if (host == null) {
      host = hostOf(span.getStringAttribute(HTTP_URL));
    }
    host = segment(host);
    String library = span.getStringAttribute(COMPONENT);
    String method = span.getStringAttribute(HTTP_METHOD);
    String externalMetric =
        "External/"
            + host
            + '/'
            + segment(library != null ? library : span.name)
            + '/'
            + segment(method);

    Set<String> rollups = new LinkedHashSet<>();
    rollups.add(EXTERNAL_ALL);
    rollups.add("External/" + host + "/all");
    String scoped = externalMetric;
    String crossProcessId = span.getStringAttribute(CAT_CROSS_PROCESS_ID);
    if (crossProcessId != null) {
      rollups.add(externalMetric);
      rollups.add("ExternalApp/" + host + '/' + crossProcessId + "/all");
      scoped =
          "ExternalTransaction/"
              + host
              + '/'
              + crossProcessId
              + '/'
              + stripSlashes(span.getStringAttribute(CAT_TRANSACTION_NAME));
    }
    return new SpanMetrics(scoped, rollups, Collections.singletonList("External/"));
  }

  private static String messageBroker(Span span) {
    String library = segment(span.getStringAttribute(MESSAGING_SYSTEM));
    String kind = "topic".equalsIgnoreCase(span.getStringAttribute(MESSAGING_DESTINATION_KIND))
        ? "Topic"
        : "Queue";
    String operation = lower(span.getStringAttribute(MESSAGING_OPERATION));
    String direction =
        "consume".equals(operation) || "receive".equals(operation) || "process".equals(operation)
            ? "Consume"
            : "Produce";
    StringBuilder name =
        new StringBuilder("MessageBroker/")
            .append(library)
            .append('/')
            .append(kind)
            .append('/')
            .append(direction)
            .append('/');
    if (Boolean.parseBoolean(span.getStringAttribute(MESSAGING_TEMPORARY))) {
      name.append("Temp");
    } else {
      String destination = span.getStringAttribute(MESSAGING_DESTINATION);
      name.append("Named/").append(segment(destination != null ? destination : span.name));
    }
    return name.toString();
  }

  static String hostOf(String url) {
    if (url == null) {
      return null;
    }
    try {
      return URI.create(url.trim()).getHost();
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String segment(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? UNKNOWN : trimmed;
  }

  private static String stripSlashes(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    int start = 0;
    while (start < value.length() && value.charAt(start) == '/') {
      start++;
    }
    return segment(value.substring(start));
  }

  private static String lower(String value) {
    return value == null ? null : value.toLowerCase(Locale.ROOT);
  }
}
