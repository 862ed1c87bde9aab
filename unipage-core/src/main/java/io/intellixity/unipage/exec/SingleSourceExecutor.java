package io.intellixity.unipage.exec;

import io.intellixity.unipage.context.ContextualValues;
import io.intellixity.unipage.engine.QueryEngine;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.mapping.RowMapper;
import io.intellixity.unipage.mapping.RowMappingPolicy;
import io.intellixity.unipage.source.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes one source's query against its engine under one interceptor chain.\n
 *
 * Steps per call:\n
 * - render query text and parameters from filters and the window\n
 * - build a fresh {@link QueryContext}\n
 * - run the chain; the terminal calls the engine's select and/or count depending on {@link QueryPhase}\n
 * - map raw rows to {@code T} under the configured {@link RowMappingPolicy}\n
 *
 * The chain is composed once at construction and shared by all requests.
 */
public final class SingleSourceExecutor<F, T> {
  private static final Logger log = LoggerFactory.getLogger(SingleSourceExecutor.class);

  private final Source<F> source;
  private final RowMapper<T> rowMapper;
  private final RowMappingPolicy mappingPolicy;
  private final QueryHandler chain;

  public SingleSourceExecutor(Source<F> source,
                              List<? extends Interceptor> endpointInterceptors,
                              RowMapper<T> rowMapper,
                              RowMappingPolicy mappingPolicy) {
    this.source = Objects.requireNonNull(source, "source");
    this.rowMapper = Objects.requireNonNull(rowMapper, "rowMapper");
    this.mappingPolicy = (mappingPolicy == null) ? RowMappingPolicy.STRICT : mappingPolicy;
    this.chain = InterceptorChain.build(
        InterceptorChain.concat(endpointInterceptors, source.interceptors()),
        terminal(source.engine()));
  }

  public Source<F> source() {
    return source;
  }

  /** Rows for {@code limit/offset} plus the total when the source has a count query. */
  public Result<T> execute(F filters, int limit, int offset, ContextualValues values) {
    Pagination.requireValid(limit, offset);
    QueryContext ctx = new QueryContext(
        source.id(), QueryPhase.SELECT_AND_COUNT,
        source.renderSelect(filters), source.selectParams(filters, limit, offset),
        source.renderCount(filters), source.hasCount() ? source.countParams(filters) : List.of(),
        filters, limit, offset, values);
    return mapRows(chain.handle(ctx));
  }

  /** Rows only, for a window computed by the union coordinator. */
  public Result<T> select(F filters, int limit, int offset, ContextualValues values) {
    Pagination.requireValid(limit, offset);
    QueryContext ctx = new QueryContext(
        source.id(), QueryPhase.SELECT,
        source.renderSelect(filters), source.selectParams(filters, limit, offset),
        null, List.of(),
        filters, limit, offset, values);
    return mapRows(chain.handle(ctx));
  }

  /** Total row count through the chain, or null when the source has no count query (or the chain reports none). */
  public Long count(F filters, ContextualValues values) {
    if (!source.hasCount()) return null;
    QueryContext ctx = new QueryContext(
        source.id(), QueryPhase.COUNT,
        null, List.of(),
        source.renderCount(filters), source.countParams(filters),
        filters, 0, 0, values);
    Long total = chain.handle(ctx).total();
    if (total != null && total < 0) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "Source '" + source.id() + "' reported a negative total: " + total);
    }
    return total;
  }

  private static QueryHandler terminal(QueryEngine engine) {
    return ctx -> {
      List<Map<String, Object>> rows = List.of();
      if (ctx.phase().selects()) {
        if (ctx.selectQuery() == null) {
          throw new QueryException(ErrorKind.QUERY_EXECUTION, "No select query for source '" + ctx.sourceId() + "'");
        }
        rows = engine.select(ctx.selectQuery(), ctx.selectParams());
      }
      Long total = null;
      if (ctx.phase().counts() && ctx.countQuery() != null) {
        total = engine.count(ctx.countQuery(), ctx.countParams());
      }
      return Result.of(rows, total);
    };
  }

  private Result<T> mapRows(Result<Map<String, Object>> raw) {
    List<T> out = new ArrayList<>(raw.data().size());
    int index = 0;
    for (Map<String, Object> row : raw.data()) {
      try {
        out.add(rowMapper.map(row));
      } catch (RuntimeException e) {
        if (mappingPolicy == RowMappingPolicy.STRICT) {
          throw new QueryException(ErrorKind.ROW_MAPPING,
              "Row " + index + " of source '" + source.id() + "' cannot be mapped: " + e.getMessage(), e);
        }
        log.warn("unipage.rows op=drop source={} rowIndex={} columns={} reason={}",
            source.id(), index, row == null ? "null" : row.keySet(), e.getMessage());
      }
      index++;
    }
    return Result.of(out, raw.total());
  }
}
