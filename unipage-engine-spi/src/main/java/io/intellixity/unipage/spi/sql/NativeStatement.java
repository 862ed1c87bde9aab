package io.intellixity.unipage.spi.sql;

/** Marker for a backend-native statement compiled from query text and positional parameters. */
public interface NativeStatement {
  /** Statement text as sent to the backend (for logs; never includes parameter values). */
  String text();

  int paramCount();
}
