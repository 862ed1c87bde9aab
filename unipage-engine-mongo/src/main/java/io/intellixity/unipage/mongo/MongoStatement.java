package io.intellixity.unipage.mongo;

import io.intellixity.unipage.spi.sql.NativeStatement;
import org.bson.Document;

import java.util.List;

/** Backend-native statement representation for MongoDB, parameters already substituted. */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    Document sort,
    Integer skip,
    Integer limit,
    List<Document> pipeline,
    String text,
    int paramCount
) implements NativeStatement {
  public enum Kind {
    FIND,
    COUNT,
    AGGREGATE
  }
}
