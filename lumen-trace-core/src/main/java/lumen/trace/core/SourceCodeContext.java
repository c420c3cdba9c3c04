package lumen.trace.core;

import java.util.Set;
import lumen.trace.core.util.StackTraces;

/** Tags a span with the application method that opened it. */
final class SourceCodeContext {
  private SourceCodeContext() {}

  static void apply(Span span, Set<String> tracerClasses) {
    StackTraceElement frame = StackTraces.callerFrame(tracerClasses);
    if (frame == null) {
      return;
    }
    span.setAttribute(
        SpanAttributes.CODE_CALLABLE_NAME, frame.getClassName() + '.' + frame.getMethodName());
    if (frame.getLineNumber() > 0) {
      span.setAttribute(SpanAttributes.CODE_LINE_NUMBER, frame.getLineNumber());
    }
    // class files only carry the source file name, not its path
    span.setAttribute(SpanAttributes.CODE_FILE_PATH, frame.getFileName());
  }
}
