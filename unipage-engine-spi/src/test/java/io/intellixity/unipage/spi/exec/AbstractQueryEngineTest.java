package io.intellixity.unipage.spi.exec;

import io.intellixity.unipage.engine.handle.EngineHandle;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.spi.sql.Dialect;
import io.intellixity.unipage.spi.sql.NativeStatement;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractQueryEngineTest {

  private record Stmt(String text, int paramCount) implements NativeStatement {}

  private static final class EchoDialect implements Dialect<Stmt> {
    @Override public String id() { return "echo"; }
    @Override public Stmt compile(String queryText, List<?> params) { return new Stmt(queryText, params.size()); }
    @Override public ErrorKind classify(Throwable error) {
      return (error instanceof IOException) ? ErrorKind.ENGINE_CONNECTIVITY : ErrorKind.QUERY_EXECUTION;
    }
  }

  private record Handle(String namespace) implements EngineHandle<Object> {
    @Override public String id() { return "echo-1"; }
    @Override public Object client() { return new Object(); }
  }

  private static final class EchoEngine extends AbstractQueryEngine<Stmt, Handle> {
    Exception failure;
    Stmt last;

    EchoEngine(String schema) { super(new EchoDialect(), new Handle(schema)); }

    @Override protected List<Map<String, Object>> executeSelect(Stmt stmt) throws Exception {
      last = stmt;
      if (failure != null) throw failure;
      return List.of(Map.of("sql", stmt.text()));
    }

    @Override protected long executeCount(Stmt stmt) throws Exception {
      last = stmt;
      if (failure != null) throw failure;
      return stmt.paramCount();
    }
  }

  @Test
  void substitutesSchema() {
    EchoEngine e = new EchoEngine("lib");
    assertEquals("select * from lib.books", e.select("select * from {schema}.books", List.of()).get(0).get("sql"));
    assertEquals("echo-1", e.id());
  }

  @Test
  void throwsWhenSchemaMissing() {
    QueryException ex = assertThrows(QueryException.class, () -> new EchoEngine(null).select("select {schema}.x", List.of()));
    assertEquals(ErrorKind.QUERY_EXECUTION, ex.kind());
  }

  @Test
  void nullParamsAreEmpty() {
    assertEquals(0L, new EchoEngine(null).count("select count(*)", null));
  }

  @Test
  void translatesFailuresThroughDialect() {
    EchoEngine e = new EchoEngine(null);
    e.failure = new IOException("connection reset");
    QueryException ex = assertThrows(QueryException.class, () -> e.select("select 1", List.of()));
    assertEquals(ErrorKind.ENGINE_CONNECTIVITY, ex.kind());
    assertTrue(ex.getMessage().contains("echo-1"));

    e.failure = new IllegalStateException("syntax");
    assertEquals(ErrorKind.QUERY_EXECUTION, assertThrows(QueryException.class, () -> e.count("x", List.of())).kind());
  }

  @Test
  void queryExceptionsPassThrough() {
    EchoEngine e = new EchoEngine(null);
    QueryException original = new QueryException(ErrorKind.CANCELLED, "stop");
    e.failure = original;
    assertSame(original, assertThrows(QueryException.class, () -> e.select("x", List.of())));
  }
}
