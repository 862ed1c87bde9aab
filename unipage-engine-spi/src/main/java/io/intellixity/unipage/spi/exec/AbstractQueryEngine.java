package io.intellixity.unipage.spi.exec;

import io.intellixity.unipage.engine.QueryEngine;
import io.intellixity.unipage.engine.handle.EngineHandle;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.spi.sql.Dialect;
import io.intellixity.unipage.spi.sql.NativeStatement;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method orchestrator for query engines.\n
 *
 * Responsibilities:\n
 * - Substitute the {@code {schema}} placeholder from {@link EngineHandle#namespace()}\n
 * - Compile text + positional params via {@link Dialect}\n
 * - Delegate execution to backend-specific hooks\n
 * - Translate backend failures into {@link QueryException} using {@link Dialect#classify(Throwable)}\n
 *
 * Errors are never converted into empty results.
 */
public abstract class AbstractQueryEngine<S extends NativeStatement, H extends EngineHandle<?>> implements QueryEngine {
  private final Dialect<S> dialect;
  private final H handle;

  protected AbstractQueryEngine(Dialect<S> dialect, H handle) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override public final String id() { return handle.id(); }

  public final H handle() { return handle; }
  protected final Dialect<S> dialect() { return dialect; }

  @Override
  public final List<Map<String, Object>> select(String query, List<?> params) {
    S stmt = prepare(query, params);
    try {
      List<Map<String, Object>> rows = executeSelect(stmt);
      return (rows == null) ? List.of() : rows;
    } catch (QueryException e) {
      throw e;
    } catch (Exception e) {
      throw translate("select", e);
    }
  }

  @Override
  public final long count(String query, List<?> params) {
    S stmt = prepare(query, params);
    try {
      return executeCount(stmt);
    } catch (QueryException e) {
      throw e;
    } catch (Exception e) {
      throw translate("count", e);
    }
  }

  /** Apply {@code {schema}} substitution; fails when the text asks for a schema the handle does not have. */
  protected final String resolveSchema(String query) {
    if (!query.contains("{schema}")) return query;
    String schema = handle.namespace();
    if (schema == null || schema.isBlank()) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION,
          "Query uses {schema} but engine '" + handle.id() + "' has no schema");
    }
    return query.replace("{schema}", schema);
  }

  private S prepare(String query, List<?> params) {
    Objects.requireNonNull(query, "query");
    return dialect.compile(resolveSchema(query), (params == null) ? List.of() : params);
  }

  private QueryException translate(String op, Exception e) {
    ErrorKind kind = dialect.classify(e);
    return new QueryException(kind == null ? ErrorKind.QUERY_EXECUTION : kind,
        "Engine '" + handle.id() + "' " + op + " failed: " + e.getMessage(), e);
  }

  // --- Backend-specific hooks ---

  protected abstract List<Map<String, Object>> executeSelect(S stmt) throws Exception;

  protected abstract long executeCount(S stmt) throws Exception;
}
