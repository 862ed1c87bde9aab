package io.intellixity.unipage.source;

import io.intellixity.unipage.engine.QueryEngine;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.exec.Interceptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One registered (engine, query) pair.\n
 *
 * Immutable once built; requests read it concurrently.\n
 *
 * Parameter defaults:\n
 * - select: {@code selectParams} if set, else {@code params(filters)} (if set) followed by {@code limit, offset}\n
 * - count: {@code countParams} if set, else {@code params(filters)} (if set), else none\n
 */
public final class Source<F> {
  private final String id;
  private final QueryEngine engine;
  private final QueryText<F> selectQuery;
  private final SelectParams<F> selectParams;
  private final QueryText<F> countQuery;
  private final FilterParams<F> countParams;
  private final FilterParams<F> params;
  private final List<Interceptor> interceptors;

  private Source(Builder<F> b) {
    this.id = b.id;
    this.engine = b.engine;
    this.selectQuery = Objects.requireNonNull(b.selectQuery, "selectQuery");
    this.selectParams = b.selectParams;
    this.countQuery = b.countQuery;
    this.countParams = b.countParams;
    this.params = b.params;
    this.interceptors = List.copyOf(b.interceptors);
  }

  public static <F> Builder<F> builder(String id, QueryEngine engine) {
    return new Builder<>(id, engine);
  }

  public String id() { return id; }
  public QueryEngine engine() { return engine; }
  public boolean hasCount() { return countQuery != null; }
  public List<Interceptor> interceptors() { return interceptors; }

  public String renderSelect(F filters) {
    return render(selectQuery, filters, "select");
  }

  /** Rendered count query, or null when this source has none. */
  public String renderCount(F filters) {
    return (countQuery == null) ? null : render(countQuery, filters, "count");
  }

  public List<Object> selectParams(F filters, int limit, int offset) {
    if (selectParams != null) return copy(selectParams.params(filters, limit, offset));
    List<Object> out = (params == null) ? new ArrayList<>() : copy(params.params(filters));
    out.add(limit);
    out.add(offset);
    return out;
  }

  public List<Object> countParams(F filters) {
    if (countParams != null) return copy(countParams.params(filters));
    if (params != null) return copy(params.params(filters));
    return new ArrayList<>();
  }

  private String render(QueryText<F> text, F filters, String which) {
    String q = text.render(filters);
    if (q == null || q.isBlank()) {
      throw new QueryException(ErrorKind.INVALID_FILTER, "The " + which + " query of source '" + id + "' rendered empty");
    }
    return q;
  }

  private static List<Object> copy(List<?> in) {
    return (in == null) ? new ArrayList<>() : new ArrayList<>(in);
  }

  @Override
  public String toString() {
    return "Source{id=" + id + ", engine=" + engine.id() + ", count=" + hasCount() + "}";
  }

  public static final class Builder<F> {
    private final String id;
    private final QueryEngine engine;
    private QueryText<F> selectQuery;
    private SelectParams<F> selectParams;
    private QueryText<F> countQuery;
    private FilterParams<F> countParams;
    private FilterParams<F> params;
    private final List<Interceptor> interceptors = new ArrayList<>();

    private Builder(String id, QueryEngine engine) {
      Objects.requireNonNull(id, "id");
      if (id.isBlank()) throw new IllegalArgumentException("source id is blank");
      this.id = id.trim();
      this.engine = Objects.requireNonNull(engine, "engine");
    }

    public Builder<F> selectQuery(String text) {
      this.selectQuery = QueryText.of(text);
      return this;
    }

    public Builder<F> selectQuery(QueryText<F> text) {
      this.selectQuery = Objects.requireNonNull(text, "text");
      return this;
    }

    public Builder<F> selectParams(SelectParams<F> selectParams) {
      this.selectParams = selectParams;
      return this;
    }

    public Builder<F> countQuery(String text) {
      this.countQuery = (text == null) ? null : QueryText.of(text);
      return this;
    }

    public Builder<F> countQuery(QueryText<F> text) {
      this.countQuery = text;
      return this;
    }

    public Builder<F> countParams(FilterParams<F> countParams) {
      this.countParams = countParams;
      return this;
    }

    /** Filter parameters shared by select (before limit/offset) and count when no specific function is set. */
    public Builder<F> params(FilterParams<F> params) {
      this.params = params;
      return this;
    }

    public Builder<F> interceptor(Interceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder<F> interceptors(List<? extends Interceptor> interceptors) {
      if (interceptors != null) for (Interceptor i : interceptors) interceptor(i);
      return this;
    }

    public Source<F> build() {
      if (selectQuery == null) throw new IllegalArgumentException("source '" + id + "' has no select query");
      return new Source<>(this);
    }
  }
}
