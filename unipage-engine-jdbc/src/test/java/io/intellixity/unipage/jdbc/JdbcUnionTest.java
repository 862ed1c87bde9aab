package io.intellixity.unipage.jdbc;

import io.intellixity.unipage.api.Endpoints;
import io.intellixity.unipage.api.UnionHandler;
import io.intellixity.unipage.context.ContextualValues;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.exec.Result;
import io.intellixity.unipage.jdbc.dialect.SqliteDialect;
import io.intellixity.unipage.source.Source;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcUnionTest {

  @TempDir
  Path tempDir;

  public record Book(long id, String title) {}

  private Source<Void> source(String id, int rows) {
    JdbcQueryEngine engine = new JdbcQueryEngine(
        new JdbcHandle(id, SqliteFixtures.books(tempDir.resolve(id + ".db"), id, rows)), new SqliteDialect());
    return Source.<Void>builder(id, engine)
        .selectQuery("SELECT id, title FROM books ORDER BY id LIMIT %s OFFSET %s")
        .countQuery("SELECT COUNT(*) FROM books")
        .build();
  }

  private static List<String> titles(Result<Book> r) {
    List<String> out = new ArrayList<>();
    for (Book b : r.data()) out.add(b.title());
    return out;
  }

  @Test
  void pagesAcrossDatabases() {
    UnionHandler<Void, Book> h = Endpoints.union(source("s1", 3), source("s2", 4), source("s3", 5))
        .rows(Book.class)
        .build();

    Result<Book> r = h.handle(null, 5, 3);

    assertEquals(List.of("s2-r1", "s2-r2", "s2-r3", "s2-r4", "s3-r1"), titles(r));
    assertEquals(12L, r.total());
  }

  @Test
  void priorityOverrideAcrossDatabases() {
    UnionHandler<Void, Book> h = Endpoints.union(source("s1", 2), source("s2", 2)).rows(Book.class).build();

    Result<Book> r = h.handle(null, 3, 1, "s2", ContextualValues.empty());

    assertEquals(List.of("s2-r2", "s1-r1", "s1-r2"), titles(r));
  }

  @Test
  void oneUnreachableDatabaseFailsTheUnion() {
    Source<Void> down = Source.<Void>builder("down",
            new JdbcQueryEngine(new JdbcHandle("down", new JdbcQueryEngineTest.RefusingDataSource()), new SqliteDialect()))
        .selectQuery("SELECT id, title FROM books LIMIT %s OFFSET %s")
        .countQuery("SELECT COUNT(*) FROM books")
        .build();
    UnionHandler<Void, Book> h = Endpoints.union(source("s1", 3), down).rows(Book.class).build();

    QueryException e = assertThrows(QueryException.class, () -> h.handle(null, 10, 0));
    assertEquals(ErrorKind.ENGINE_CONNECTIVITY, e.kind());
  }
}
