package lumen.trace.core;

/** Attribute keys the core reads when naming metrics and enriching spans. */
public final class SpanAttributes {
  private SpanAttributes() {}

  public static final String DB_SYSTEM = "db.system";
  public static final String DB_STATEMENT = "db.statement";
  public static final String DB_OPERATION = "db.operation";
  public static final String DB_COLLECTION = "db.collection";
  public static final String DB_NAME = "db.name";

  public static final String SERVER_ADDRESS = "server.address";
  public static final String SERVER_PORT = "server.port";

  // written by the tracer when a datastore span closes
  public static final String DB_INSTANCE = "db.instance";
  public static final String PEER_ADDRESS = "peer.address";
  public static final String PEER_HOSTNAME = "peer.hostname";

  // written by the tracer when a span opens
  public static final String CODE_CALLABLE_NAME = "source_code_context.callable_name";
  public static final String CODE_LINE_NUMBER = "source_code_context.line_number";
  public static final String CODE_FILE_PATH = "source_code_context.file_path";

  public static final String HTTP_URL = "http.url";
  public static final String HTTP_METHOD = "http.method";
  public static final String COMPONENT = "component";

  public static final String MESSAGING_SYSTEM = "messaging.system";
  public static final String MESSAGING_DESTINATION = "messaging.destination";
  public static final String MESSAGING_DESTINATION_KIND = "messaging.destination.kind";
  public static final String MESSAGING_TEMPORARY = "messaging.destination.temporary";
  public static final String MESSAGING_OPERATION = "messaging.operation";

  // set from an inbound X-NewRelic-App-Data response header
  public static final String CAT_CROSS_PROCESS_ID = "cat.cross_process_id";
  public static final String CAT_TRANSACTION_NAME = "cat.transaction_name";
  public static final String CAT_TRANSACTION_GUID = "cat.transaction_guid";
}
