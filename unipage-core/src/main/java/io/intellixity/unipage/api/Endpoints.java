package io.intellixity.unipage.api;

import io.intellixity.unipage.context.ContextualProvider;
import io.intellixity.unipage.exec.Interceptor;
import io.intellixity.unipage.exec.SingleSourceExecutor;
import io.intellixity.unipage.mapping.RowMapper;
import io.intellixity.unipage.mapping.RowMappers;
import io.intellixity.unipage.mapping.RowMappingPolicy;
import io.intellixity.unipage.source.Source;
import io.intellixity.unipage.union.UnionOptions;
import io.intellixity.unipage.union.UnionPaginationCoordinator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for registering endpoints.\n
 *
 * <pre>
 * SelectHandler&lt;BookFilters, Book&gt; books = Endpoints.single(booksSource)
 *     .rows(Book.class)
 *     .interceptor(new LoggingInterceptor())
 *     .build();
 * </pre>
 *
 * Builders start with raw rows ({@code Map<String, Object>}); {@link SingleBuilder#rows(Class)} or
 * {@link SingleBuilder#rowMapper(RowMapper)} switch the row type.
 */
public final class Endpoints {
  private Endpoints() {}

  public static <F> SingleBuilder<F, Map<String, Object>> single(Source<F> source) {
    return new SingleBuilder<>(Objects.requireNonNull(source, "source"), RowMappers.identity());
  }

  @SafeVarargs
  public static <F> UnionBuilder<F, Map<String, Object>> union(Source<F>... sources) {
    return union(Arrays.asList(sources));
  }

  public static <F> UnionBuilder<F, Map<String, Object>> union(List<Source<F>> sources) {
    Objects.requireNonNull(sources, "sources");
    if (sources.isEmpty()) throw new IllegalArgumentException("union needs at least one source");
    Set<String> ids = new HashSet<>();
    for (Source<F> s : sources) {
      Objects.requireNonNull(s, "source");
      if (!ids.add(s.id())) throw new IllegalArgumentException("Duplicate source id: " + s.id());
    }
    return new UnionBuilder<>(List.copyOf(sources), RowMappers.identity());
  }

  public static final class SingleBuilder<F, T> {
    private final Source<F> source;
    private final RowMapper<T> rowMapper;
    private RowMappingPolicy mappingPolicy = RowMappingPolicy.STRICT;
    private final List<Interceptor> interceptors = new ArrayList<>();
    private final List<ContextualProvider> providers = new ArrayList<>();

    private SingleBuilder(Source<F> source, RowMapper<T> rowMapper) {
      this.source = source;
      this.rowMapper = rowMapper;
    }

    public <R> SingleBuilder<F, R> rowMapper(RowMapper<R> mapper) {
      SingleBuilder<F, R> b = new SingleBuilder<>(source, Objects.requireNonNull(mapper, "mapper"));
      b.mappingPolicy = mappingPolicy;
      b.interceptors.addAll(interceptors);
      b.providers.addAll(providers);
      return b;
    }

    public <R> SingleBuilder<F, R> rows(Class<R> type) {
      return rowMapper(RowMappers.jackson(type));
    }

    public SingleBuilder<F, T> mappingPolicy(RowMappingPolicy policy) {
      this.mappingPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    public SingleBuilder<F, T> interceptor(Interceptor interceptor) {
      interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public SingleBuilder<F, T> interceptors(List<? extends Interceptor> list) {
      if (list != null) for (Interceptor i : list) interceptor(i);
      return this;
    }

    public SingleBuilder<F, T> contextualProvider(ContextualProvider provider) {
      providers.add(Objects.requireNonNull(provider, "provider"));
      return this;
    }

    public SelectHandler<F, T> build() {
      return new SelectHandler<>(new SingleSourceExecutor<>(source, interceptors, rowMapper, mappingPolicy), providers);
    }
  }

  public static final class UnionBuilder<F, T> {
    private final List<Source<F>> sources;
    private final RowMapper<T> rowMapper;
    private RowMappingPolicy mappingPolicy = RowMappingPolicy.STRICT;
    private List<String> defaultPriority = List.of();
    private UnionOptions options = UnionOptions.defaults();
    private final List<Interceptor> interceptors = new ArrayList<>();
    private final List<ContextualProvider> providers = new ArrayList<>();

    private UnionBuilder(List<Source<F>> sources, RowMapper<T> rowMapper) {
      this.sources = sources;
      this.rowMapper = rowMapper;
    }

    public <R> UnionBuilder<F, R> rowMapper(RowMapper<R> mapper) {
      UnionBuilder<F, R> b = new UnionBuilder<>(sources, Objects.requireNonNull(mapper, "mapper"));
      b.mappingPolicy = mappingPolicy;
      b.defaultPriority = defaultPriority;
      b.options = options;
      b.interceptors.addAll(interceptors);
      b.providers.addAll(providers);
      return b;
    }

    public <R> UnionBuilder<F, R> rows(Class<R> type) {
      return rowMapper(RowMappers.jackson(type));
    }

    public UnionBuilder<F, T> mappingPolicy(RowMappingPolicy policy) {
      this.mappingPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /** Sources listed first are consulted first; unlisted ones follow in registration order. */
    public UnionBuilder<F, T> defaultPriority(String... ids) {
      this.defaultPriority = List.of(ids);
      return this;
    }

    public UnionBuilder<F, T> defaultPriority(List<String> ids) {
      this.defaultPriority = (ids == null) ? List.of() : List.copyOf(ids);
      return this;
    }

    public UnionBuilder<F, T> options(UnionOptions options) {
      this.options = Objects.requireNonNull(options, "options");
      return this;
    }

    public UnionBuilder<F, T> interceptor(Interceptor interceptor) {
      interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public UnionBuilder<F, T> interceptors(List<? extends Interceptor> list) {
      if (list != null) for (Interceptor i : list) interceptor(i);
      return this;
    }

    public UnionBuilder<F, T> contextualProvider(ContextualProvider provider) {
      providers.add(Objects.requireNonNull(provider, "provider"));
      return this;
    }

    public UnionHandler<F, T> build() {
      List<SingleSourceExecutor<F, T>> executors = new ArrayList<>(sources.size());
      for (Source<F> s : sources) {
        executors.add(new SingleSourceExecutor<>(s, interceptors, rowMapper, mappingPolicy));
      }
      return new UnionHandler<>(new UnionPaginationCoordinator<>(executors, defaultPriority, options), providers);
    }
  }
}
