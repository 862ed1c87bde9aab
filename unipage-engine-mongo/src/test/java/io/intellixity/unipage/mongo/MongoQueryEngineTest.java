package io.intellixity.unipage.mongo;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoQueryEngineTest {

  @Test
  void unreachableServerIsConnectivityFailure() {
    try (MongoQueryEngine engine = MongoQueryEngines.connect("mongo-down", "mongodb://localhost:1", "library", 200)) {
      QueryException e = assertThrows(QueryException.class,
          () -> engine.select("{\"find\": \"books\", \"limit\": {\"$param\": 0}}", List.of(5)));
      assertEquals(ErrorKind.ENGINE_CONNECTIVITY, e.kind());
      assertTrue(e.getMessage().contains("mongo-down"));
    }
  }

  @Test
  void zeroLimitFind_returnsNoRowsWithoutQuerying() {
    try (MongoQueryEngine engine = MongoQueryEngines.connect("mongo-down", "mongodb://localhost:1", "library", 200)) {
      assertEquals(List.of(), engine.select("{\"find\": \"books\", \"limit\": {\"$param\": 0}}", List.of(0)));
    }
  }

  @Test
  void compileErrorsSurfaceBeforeAnyNetworkCall() {
    try (MongoQueryEngine engine = MongoQueryEngines.connect("mongo-down", "mongodb://localhost:1", "library", 200)) {
      QueryException e = assertThrows(QueryException.class,
          () -> engine.count("{\"find\": \"books\", \"filter\": {\"$param\": 3}}", List.of()));
      assertEquals(ErrorKind.QUERY_EXECUTION, e.kind());
    }
  }

  @Test
  void rowsAreConvertedToPlainJava() {
    ObjectId id = new ObjectId();
    Document doc = new Document("_id", id)
        .append("price", new Decimal128(new BigDecimal("9.50")))
        .append("author", new Document("name", "odd"))
        .append("tags", List.of(new Document("t", "x")));

    Map<String, Object> row = MongoQueryEngine.toRow(doc);

    assertEquals(id.toHexString(), row.get("_id"));
    assertEquals(new BigDecimal("9.50"), row.get("price"));
    assertEquals(Map.of("name", "odd"), row.get("author"));
    assertEquals(List.of(Map.of("t", "x")), row.get("tags"));
  }
}
