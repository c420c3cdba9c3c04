package lumen.trace.core;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lightweight SQL inspection: leading verb, operation and target table, and literal obfuscation.
 * This is not a parser; anything it does not recognise is reported as {@link #OTHER}.
 */
public final class SqlStatements {

  public static final String OTHER = "other";

  private static final Set<String> OPERATIONS_WITHOUT_TABLE =
      new HashSet<>(Arrays.asList("call", "show", "set", "commit", "rollback", "begin", "exec"));

  private SqlStatements() {}

  /** Result of {@link #parse}; {@code table} is {@code null} when no target was recognised. */
  public static final class Statement {
    public final String operation;
    public final String table;

    Statement(String operation, String table) {
      this.operation = operation;
      this.table = table;
    }

    @Override
    public String toString() {
      return operation + (table == null ? "" : " " + table);
    }
  }

  private static final Statement UNPARSEABLE = new Statement(OTHER, OTHER);

  /** The first keyword of the statement, lower-cased, or the empty string. */
  public static String leadingVerb(String sql) {
    if (sql == null) {
      return "";
    }
    int start = skipIgnorable(sql, 0);
    int end = start;
    while (end < sql.length() && Character.isLetter(sql.charAt(end))) {
      end++;
    }
    return sql.substring(start, end).toLowerCase(Locale.ROOT);
  }

  public static Statement parse(String sql) {
    String verb = leadingVerb(sql);
    switch (verb) {
      case "select":
        return new Statement(verb, tableAfter(sql, "from"));
      case "delete":
        return new Statement(verb, tableAfter(sql, "from"));
      case "insert":
        return new Statement(verb, tableAfter(sql, "into"));
      case "update":
        return new Statement(verb, tableAfter(sql, "update"));
      default:
        if (OPERATIONS_WITHOUT_TABLE.contains(verb)) {
          return new Statement(verb, null);
        }
        return UNPARSEABLE;
    }
  }

  /**
   * Replaces string and numeric literals with {@code ?}. Quoted identifiers are left alone;
   * comments are kept as written.
   */
  public static String obfuscate(String sql) {
    if (sql == null) {
      return null;
    }
    StringBuilder out = new StringBuilder(sql.length());
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (c == '\'') {
        i = skipQuoted(sql, i, '\'');
        out.append('?');
      } else if (isNumberStart(sql, i)) {
        i++;
        while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
          i++;
        }
        out.append('?');
      } else if (Character.isLetter(c) || c == '_' || c == '"' || c == '`') {
        int start = i;
        if (c == '"' || c == '`') {
          i = skipQuoted(sql, i, c);
        } else {
          while (i < n && (isIdentifierChar(sql.charAt(i)) || sql.charAt(i) == '$')) {
            i++;
          }
        }
        out.append(sql, start, i);
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private static boolean isNumberStart(String sql, int i) {
    char c = sql.charAt(i);
    if (Character.isDigit(c)) {
      return true;
    }
    // negative literal such as "= -1", but not the subtraction in "a-1"
    if (c == '-' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
      int prev = i - 1;
      while (prev >= 0 && Character.isWhitespace(sql.charAt(prev))) {
        prev--;
      }
      return prev < 0 || "=<>(,+-*/".indexOf(sql.charAt(prev)) >= 0;
    }
    return false;
  }

  /** Index just past the closing quote; doubled quotes are escapes. */
  private static int skipQuoted(String sql, int openIndex, char quote) {
    int i = openIndex + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '\\' && quote == '\'') {
        i += 2;
        continue;
      }
      if (c == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  private static int skipIgnorable(String sql, int from) {
    int i = from;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c) || c == '(') {
        i++;
      } else if (sql.startsWith("/*", i)) {
        int close = sql.indexOf("*/", i + 2);
        i = close < 0 ? sql.length() : close + 2;
      } else if (sql.startsWith("--", i)) {
        int eol = sql.indexOf('\n', i);
        i = eol < 0 ? sql.length() : eol + 1;
      } else {
        break;
      }
    }
    return i;
  }

  /** The identifier following the first standalone {@code keyword}, or {@code null}. */
  private static String tableAfter(String sql, String keyword) {
    String lower = sql.toLowerCase(Locale.ROOT);
    int at = findKeyword(lower, keyword, 0);
    if (at < 0) {
      return null;
    }
    int i = at + keyword.length();
    while (i < sql.length() && Character.isWhitespace(sql.charAt(i))) {
      i++;
    }
    if (i >= sql.length() || sql.charAt(i) == '(') {
      // subquery or nothing at all
      return null;
    }
    StringBuilder table = new StringBuilder();
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$') {
        table.append(c);
      } else if (c != '"' && c != '`' && c != '[' && c != ']') {
        break;
      }
      i++;
    }
    return table.length() == 0 ? null : table.toString().toLowerCase(Locale.ROOT);
  }

  private static int findKeyword(String lower, String keyword, int from) {
    int at = lower.indexOf(keyword, from);
    while (at >= 0) {
      boolean startOk = at == 0 || !isIdentifierChar(lower.charAt(at - 1));
      int end = at + keyword.length();
      boolean endOk = end >= lower.length() || !isIdentifierChar(lower.charAt(end));
      if (startOk && endOk) {
        return at;
      }
      at = lower.indexOf(keyword, at + 1);
    }
    return -1;
  }

  private static boolean isIdentifierChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
