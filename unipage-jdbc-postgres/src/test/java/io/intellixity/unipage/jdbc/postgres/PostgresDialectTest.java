package io.intellixity.unipage.jdbc.postgres;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.jdbc.JdbcSettings;
import io.intellixity.unipage.jdbc.SqlStatement;
import io.intellixity.unipage.jdbc.dialect.JdbcDialects;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {

  private final PostgresDialect d = new PostgresDialect();

  @Test
  void isDiscoverable() {
    assertInstanceOf(PostgresDialect.class, JdbcDialects.byId("postgres"));
  }

  @Test
  void buildsUrlFromHostAndDatabase() {
    assertEquals("jdbc:postgresql://pg:5432/library",
        d.jdbcUrl(JdbcSettings.builder().host("pg").database("library").build()));
    assertEquals("jdbc:postgresql://pg:6543/library",
        d.jdbcUrl(JdbcSettings.builder().host("pg").port(6543).database("library").build()));
  }

  @Test
  void keepsCastsWhileRewritingPlaceholders() {
    SqlStatement s = d.compile("SELECT * FROM books WHERE meta::text LIKE %s LIMIT %s OFFSET %s", List.of("%x%", 10, 0));
    assertEquals("SELECT * FROM books WHERE meta::text LIKE ? LIMIT ? OFFSET ?", s.sql());
    assertEquals(3, s.paramCount());
  }

  @Test
  void classifiesConnectionErrors() {
    assertEquals(ErrorKind.ENGINE_CONNECTIVITY,
        d.classify(new PSQLException("refused", PSQLState.CONNECTION_UNABLE_TO_CONNECT)));
    assertEquals(ErrorKind.ENGINE_CONNECTIVITY,
        d.classify(new PSQLException("canceled", PSQLState.QUERY_CANCELED)));
    assertEquals(ErrorKind.QUERY_EXECUTION,
        d.classify(new PSQLException("syntax", PSQLState.SYNTAX_ERROR)));
    assertEquals(ErrorKind.QUERY_EXECUTION, d.classify(new SQLException("no state")));
  }

  @Test
  void writesJsonParameters() {
    assertEquals("{\"a\":1}", PostgresJson.write(java.util.Map.of("a", 1)));
  }
}
