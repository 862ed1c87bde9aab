package io.intellixity.unipage.mongo;

import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.spi.sql.Dialect;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mongo dialect: query text is a JSON command document.\n
 *
 * Supported commands:\n
 * - {@code {"find": "<collection>", "filter": {...}, "projection": {...}, "sort": {...}, "skip": n, "limit": n}}\n
 * - {@code {"count": "<collection>", "filter": {...}}}\n
 * - {@code {"aggregate": "<collection>", "pipeline": [...]}}\n
 *
 * Positional parameters are written {@code {"$param": N}} (0-based) anywhere in the document and are replaced
 * by the parameter value after parsing, so values are never spliced into JSON text.
 */
public final class MongoDialect implements Dialect<MongoStatement> {
  static final String PARAM = "$param";

  @Override public String id() { return "mongo"; }

  @Override
  public MongoStatement compile(String queryText, List<?> params) {
    Document cmd;
    try {
      cmd = Document.parse(queryText);
    } catch (JsonParseException | IllegalArgumentException e) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "Query text is not a JSON document: " + e.getMessage(), e);
    }
    Document bound = (Document) substitute(cmd, params);
    return toStatement(bound, queryText, params.size());
  }

  @Override
  public ErrorKind classify(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof MongoInterruptedException) return ErrorKind.CANCELLED;
      if (t instanceof MongoTimeoutException) return ErrorKind.ENGINE_CONNECTIVITY;
      if (t instanceof MongoSocketException) return ErrorKind.ENGINE_CONNECTIVITY;
      if (t instanceof MongoExecutionTimeoutException) return ErrorKind.ENGINE_CONNECTIVITY;
    }
    return ErrorKind.QUERY_EXECUTION;
  }

  private static MongoStatement toStatement(Document cmd, String text, int paramCount) {
    if (cmd.isEmpty()) throw new QueryException(ErrorKind.QUERY_EXECUTION, "Empty Mongo command");
    String command = cmd.keySet().iterator().next();
    String collection = collection(cmd, command);
    return switch (command) {
      case "find" -> new MongoStatement(MongoStatement.Kind.FIND, collection,
          document(cmd, "filter"), document(cmd, "projection"), document(cmd, "sort"),
          integer(cmd, "skip"), integer(cmd, "limit"), List.of(), text, paramCount);
      case "count" -> new MongoStatement(MongoStatement.Kind.COUNT, collection,
          document(cmd, "filter"), null, null, null, null, List.of(), text, paramCount);
      case "aggregate" -> new MongoStatement(MongoStatement.Kind.AGGREGATE, collection,
          new Document(), null, null, null, null, pipeline(cmd), text, paramCount);
      default -> throw new QueryException(ErrorKind.QUERY_EXECUTION,
          "Unknown Mongo command '" + command + "' (expected find, count or aggregate)");
    };
  }

  private static String collection(Document cmd, String command) {
    Object c = cmd.get(command);
    if (!(c instanceof String s) || s.isBlank()) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "Mongo command '" + command + "' needs a collection name");
    }
    return s;
  }

  private static Document document(Document cmd, String key) {
    Object v = cmd.get(key);
    if (v == null) return new Document();
    if (v instanceof Document d) return d;
    throw new QueryException(ErrorKind.QUERY_EXECUTION, "'" + key + "' must be a document");
  }

  private static Integer integer(Document cmd, String key) {
    Object v = cmd.get(key);
    if (v == null) return null;
    if (v instanceof Number n) {
      long l = n.longValue();
      if (l < 0 || l > Integer.MAX_VALUE) throw new QueryException(ErrorKind.QUERY_EXECUTION, "'" + key + "' out of range: " + l);
      return (int) l;
    }
    throw new QueryException(ErrorKind.QUERY_EXECUTION, "'" + key + "' must be a number");
  }

  private static List<Document> pipeline(Document cmd) {
    Object v = cmd.get("pipeline");
    if (!(v instanceof List<?> stages)) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "'pipeline' must be an array of stages");
    }
    List<Document> out = new ArrayList<>(stages.size());
    for (Object s : stages) {
      if (!(s instanceof Document d)) throw new QueryException(ErrorKind.QUERY_EXECUTION, "pipeline stage must be a document");
      out.add(d);
    }
    return out;
  }

  private static Object substitute(Object node, List<?> params) {
    if (node instanceof Document d) {
      if (d.size() == 1 && d.containsKey(PARAM)) return param(d.get(PARAM), params);
      Document out = new Document();
      for (Map.Entry<String, Object> e : d.entrySet()) out.put(e.getKey(), substitute(e.getValue(), params));
      return out;
    }
    if (node instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(substitute(o, params));
      return out;
    }
    return node;
  }

  private static Object param(Object index, List<?> params) {
    if (!(index instanceof Integer i)) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "$param index must be an integer: " + index);
    }
    if (i < 0 || i >= params.size()) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION,
          "$param " + i + " out of range; " + params.size() + " parameter(s) supplied");
    }
    return toBsonValue(params.get(i));
  }

  /** Values the default codec registry cannot encode are converted here. */
  private static Object toBsonValue(Object v) {
    if (v instanceof Enum<?> e) return e.name();
    if (v instanceof UUID u) return u.toString();
    return v;
  }
}
