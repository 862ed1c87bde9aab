package io.intellixity.unipage.jdbc;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;

/**
 * Rewrites query text into JDBC SQL with '?' binds.\n
 *
 * Rules:\n
 * - {@code %s} becomes {@code ?}; {@code ?} is kept as is\n
 * - {@code %%} becomes a literal {@code %}\n
 * - anything inside single-quoted literals (with '' escapes), double-quoted identifiers,
 *   {@code --} line comments and block comments is copied verbatim\n
 *
 * Purely lexical scanning.
 */
public final class PlaceholderCompiler {
  private PlaceholderCompiler() {}

  public record Compiled(String sql, int placeholders) {}

  public static Compiled compile(String sql) {
    if (sql == null) throw new QueryException(ErrorKind.QUERY_EXECUTION, "SQL text is null");
    StringBuilder out = new StringBuilder(sql.length());
    int placeholders = 0;
    int n = sql.length();

    for (int i = 0; i < n; i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        int end = skipQuoted(sql, i, ch);
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }
      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        end = (end < 0) ? n : end;
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }
      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        end = (end < 0) ? n : end + 2;
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }
      if (ch == '%' && i + 1 < n) {
        char next = sql.charAt(i + 1);
        if (next == 's') {
          out.append('?');
          placeholders++;
          i++;
          continue;
        }
        if (next == '%') {
          out.append('%');
          i++;
          continue;
        }
      }
      if (ch == '?') placeholders++;
      out.append(ch);
    }

    return new Compiled(out.toString(), placeholders);
  }

  /** Compile and check the placeholder count against {@code paramCount}. */
  public static String toJdbcSql(String sql, int paramCount) {
    Compiled c = compile(sql);
    if (c.placeholders() != paramCount) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION,
          "Query has " + c.placeholders() + " placeholder(s) but " + paramCount + " parameter(s) were supplied");
    }
    return c.sql();
  }

  private static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      char ch = sql.charAt(i);
      if (ch == quote) {
        // Doubled quote is an escape
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    throw new QueryException(ErrorKind.QUERY_EXECUTION, "Unterminated quoted section starting at offset " + start);
  }
}
