package lumen.trace.core;

public enum SpanKind {
  FUNCTION,
  DATABASE,
  DATASTORE,
  EXTERNAL,
  MESSAGE,
  CUSTOM;

  public boolean isDatabase() {
    return this == DATABASE || this == DATASTORE;
  }
}
