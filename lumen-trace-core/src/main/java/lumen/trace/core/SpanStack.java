package lumen.trace.core;

import java.util.Arrays;

/**
 * Stack of open span indices for one transaction. The depth cap lives here only: {@link #push}
 * refuses to grow past {@code maxDepth}.
 */
final class SpanStack {

  static final int EMPTY = -1;

  private final int maxDepth;
  private int[] stack;
  private int size;

  SpanStack(int maxDepth) {
    this.maxDepth = maxDepth;
    this.stack = new int[Math.min(16, maxDepth)];
  }

  /** @return false when the stack is already at its depth cap */
  boolean push(int spanIndex) {
    if (size >= maxDepth) {
      return false;
    }
    if (size == stack.length) {
      stack = Arrays.copyOf(stack, Math.min(maxDepth, stack.length * 2));
    }
    stack[size++] = spanIndex;
    return true;
  }

  int pop() {
    if (size == 0) {
      return EMPTY;
    }
    return stack[--size];
  }

  int top() {
    return size == 0 ? EMPTY : stack[size - 1];
  }

  /** Position of {@code spanIndex} counted from the bottom, or -1 when it is not open. */
  int indexOf(int spanIndex) {
    for (int i = size - 1; i >= 0; i--) {
      if (stack[i] == spanIndex) {
        return i;
      }
    }
    return -1;
  }

  int get(int position) {
    return stack[position];
  }

  int size() {
    return size;
  }

  boolean isEmpty() {
    return size == 0;
  }

  int maxDepth() {
    return maxDepth;
  }
}
