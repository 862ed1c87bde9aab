package io.intellixity.unipage.mongo;

import com.mongodb.MongoSocketOpenException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoDialectTest {
  private final MongoDialect dialect = new MongoDialect();

  @Test
  void findSubstitutesParamsAfterParsing() {
    MongoStatement st = dialect.compile(
        "{\"find\": \"books\", \"filter\": {\"author\": {\"$param\": 0}}, \"sort\": {\"_id\": 1},"
            + " \"limit\": {\"$param\": 1}, \"skip\": {\"$param\": 2}}",
        List.of("odd\"}, {\"x", 10, 20));

    assertEquals(MongoStatement.Kind.FIND, st.kind());
    assertEquals("books", st.collection());
    assertEquals("odd\"}, {\"x", st.filter().getString("author"));
    assertEquals(new Document("_id", 1), st.sort());
    assertEquals(10, st.limit());
    assertEquals(20, st.skip());
    assertEquals(3, st.paramCount());
  }

  @Test
  void paramsInsideArraysAreReplaced() {
    MongoStatement st = dialect.compile(
        "{\"find\": \"books\", \"filter\": {\"year\": {\"$in\": [{\"$param\": 0}, {\"$param\": 1}]}}}",
        List.of(2001, 2003));

    Document in = (Document) st.filter().get("year");
    assertEquals(List.of(2001, 2003), in.get("$in"));
    assertNull(st.limit());
  }

  @Test
  void countAndAggregateCommands() {
    MongoStatement count = dialect.compile("{\"count\": \"books\", \"filter\": {}}", List.of());
    assertEquals(MongoStatement.Kind.COUNT, count.kind());

    MongoStatement agg = dialect.compile(
        "{\"aggregate\": \"books\", \"pipeline\": [{\"$match\": {}}, {\"$count\": \"n\"}]}", List.of());
    assertEquals(MongoStatement.Kind.AGGREGATE, agg.kind());
    assertEquals(2, agg.pipeline().size());
  }

  @Test
  void badCommandsAreQueryExecutionErrors() {
    assertKind(() -> dialect.compile("not json", List.of()));
    assertKind(() -> dialect.compile("{\"delete\": \"books\"}", List.of()));
    assertKind(() -> dialect.compile("{\"find\": \"\"}", List.of()));
    assertKind(() -> dialect.compile("{\"find\": \"books\", \"filter\": {\"a\": {\"$param\": 1}}}", List.of("x")));
    assertKind(() -> dialect.compile("{\"aggregate\": \"books\", \"pipeline\": 3}", List.of()));
  }

  @Test
  void classifiesDriverFailures() {
    assertEquals(ErrorKind.ENGINE_CONNECTIVITY, dialect.classify(new MongoTimeoutException("no server")));
    assertEquals(ErrorKind.ENGINE_CONNECTIVITY,
        dialect.classify(new RuntimeException(new MongoSocketOpenException("refused", new ServerAddress("localhost", 1)))));
    assertEquals(ErrorKind.QUERY_EXECUTION, dialect.classify(new IllegalStateException("boom")));
  }

  private static void assertKind(org.junit.jupiter.api.function.Executable call) {
    QueryException e = assertThrows(QueryException.class, call);
    assertEquals(ErrorKind.QUERY_EXECUTION, e.kind());
  }
}
