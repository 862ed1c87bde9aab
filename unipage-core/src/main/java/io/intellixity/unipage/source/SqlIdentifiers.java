package io.intellixity.unipage.source;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;

import java.util.regex.Pattern;

/** Validation for identifiers that shape dynamic queries (table and column names). */
public final class SqlIdentifiers {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
  private static final int MAX_LENGTH = 128;

  private SqlIdentifiers() {}

  public static boolean isValid(String ident) {
    return ident != null && ident.length() <= MAX_LENGTH && IDENT.matcher(ident).matches();
  }

  /** Trimmed identifier, or {@link ErrorKind#INVALID_FILTER} when empty or not a plain (optionally dotted) name. */
  public static String require(String name, Object value) {
    String s = (value == null) ? null : String.valueOf(value).trim();
    if (s == null || s.isEmpty()) {
      throw new QueryException(ErrorKind.INVALID_FILTER, "Identifier '" + name + "' must not be empty");
    }
    if (!isValid(s)) {
      throw new QueryException(ErrorKind.INVALID_FILTER, "Identifier '" + name + "' is not a valid name: " + abbreviate(s));
    }
    return s;
  }

  private static String abbreviate(String s) {
    return s.length() <= 40 ? s : s.substring(0, 40) + "...";
  }
}
