package lumen.trace.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public final class StackTraces {
  private StackTraces() {}

  private static final int TAIL_FRAMES = 4;

  /**
   * Snapshot of the calling thread's stack. Leading frames from {@code skippedClasses} (and their
   * nested classes) are dropped so the snapshot starts at application code.
   */
  public static List<String> capture(Set<String> skippedClasses, int maxFrames) {
    StackTraceElement[] frames = new Throwable().getStackTrace();
    int first = 0;
    while (first < frames.length && isSkipped(frames[first], skippedClasses)) {
      first++;
    }
    return truncate(frames, first, maxFrames);
  }

  /** The first frame of the calling thread outside {@code skippedClasses}, or {@code null}. */
  public static StackTraceElement callerFrame(Set<String> skippedClasses) {
    for (StackTraceElement frame : new Throwable().getStackTrace()) {
      if (!isSkipped(frame, skippedClasses)) {
        return frame;
      }
    }
    return null;
  }

  /** The frames of {@code t}, followed by those of its causes, limited to {@code maxFrames}. */
  public static List<String> forThrowable(Throwable t, int maxFrames) {
    List<String> lines = new ArrayList<>();
    Throwable current = t;
    int causes = 0;
    while (current != null && lines.size() < maxFrames && causes++ < 8) {
      if (current != t) {
        lines.add("Caused by: " + current);
      }
      lines.addAll(truncate(current.getStackTrace(), 0, maxFrames - lines.size()));
      current = current.getCause() == current ? null : current.getCause();
    }
    return lines;
  }

  /**
   * Keeps the head and the last few frames when there are more than {@code maxFrames}, with a
   * marker line counting the omitted frames in between.
   */
  static List<String> truncate(StackTraceElement[] frames, int from, int maxFrames) {
    int available = frames.length - from;
    if (available <= 0 || maxFrames <= 0) {
      return Collections.emptyList();
    }
    List<String> lines = new ArrayList<>(Math.min(available, maxFrames));
    if (available <= maxFrames) {
      for (int i = from; i < frames.length; i++) {
        lines.add(frames[i].toString());
      }
      return lines;
    }
    int tail = maxFrames > 2 * TAIL_FRAMES ? TAIL_FRAMES : 0;
    int head = maxFrames - tail - (tail > 0 ? 1 : 0);
    for (int i = from; i < from + head; i++) {
      lines.add(frames[i].toString());
    }
    if (tail > 0) {
      lines.add("... " + (available - head - tail) + " frames omitted ...");
      for (int i = frames.length - tail; i < frames.length; i++) {
        lines.add(frames[i].toString());
      }
    }
    return lines;
  }

  private static boolean isSkipped(StackTraceElement frame, Set<String> skippedClasses) {
    String className = frame.getClassName();
    int nested = className.indexOf('$');
    String outer = nested < 0 ? className : className.substring(0, nested);
    return outer.equals(StackTraces.class.getName()) || skippedClasses.contains(outer);
  }
}
