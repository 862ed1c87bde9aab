package io.intellixity.unipage.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.spi.exec.AbstractQueryEngine;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mongo backend engine using the official MongoDB Java sync driver.\n
 *
 * Rows are plain maps: ObjectIds become hex strings, Decimal128 becomes BigDecimal, nested documents become maps.
 */
public final class MongoQueryEngine extends AbstractQueryEngine<MongoStatement, MongoHandle> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MongoQueryEngine.class);

  private final MongoDatabase db;
  private final boolean ownsClient;

  public MongoQueryEngine(MongoHandle handle, boolean ownsClient) {
    super(new MongoDialect(), Objects.requireNonNull(handle, "handle"));
    this.db = handle.client().getDatabase(handle.database());
    this.ownsClient = ownsClient;
  }

  public MongoQueryEngine(MongoHandle handle) {
    this(handle, false);
  }

  @Override
  protected List<Map<String, Object>> executeSelect(MongoStatement st) {
    debug("SELECT", st);
    MongoCollection<Document> col = db.getCollection(st.collection());
    Iterable<Document> docs;
    switch (st.kind()) {
      case AGGREGATE -> docs = col.aggregate(st.pipeline());
      case FIND -> {
        // the driver reads limit 0 as "no limit"
        if (st.limit() != null && st.limit() == 0) return List.of();
        FindIterable<Document> find = col.find(st.filter());
        if (st.projection() != null && !st.projection().isEmpty()) find = find.projection(st.projection());
        if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
        if (st.skip() != null) find = find.skip(st.skip());
        if (st.limit() != null) find = find.limit(st.limit());
        docs = find;
      }
      default -> throw new QueryException(ErrorKind.QUERY_EXECUTION, "'count' command cannot be used as a select query");
    }

    List<Map<String, Object>> out = new ArrayList<>();
    for (Document d : docs) out.add(toRow(d));
    return out;
  }

  @Override
  protected long executeCount(MongoStatement st) {
    debug("COUNT", st);
    MongoCollection<Document> col = db.getCollection(st.collection());
    if (st.kind() == MongoStatement.Kind.AGGREGATE) {
      Document first = col.aggregate(st.pipeline()).first();
      if (first == null) return 0;
      Object n = first.get("n");
      if (n instanceof Number nn) return nn.longValue();
      if (n == null) return 0;
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "Aggregate count field 'n' is not a number: " + n);
    }
    return col.countDocuments(st.filter());
  }

  static Map<String, Object> toRow(Document d) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : d.entrySet()) row.put(e.getKey(), toJava(e.getValue()));
    return row;
  }

  private static Object toJava(Object v) {
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Decimal128 dec) return dec.bigDecimalValue();
    if (v instanceof Document d) return toRow(d);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toJava(o));
      return out;
    }
    return v;
  }

  @Override
  public void close() {
    if (ownsClient) handle().client().close();
  }

  private void debug(String op, MongoStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("unipage.mongo op={} kind={} handleId={} database={} collection={} bindCount={}",
        op, st.kind(), id(), handle().database(), st.collection(), st.paramCount());
  }
}
