package io.intellixity.unipage.examples.config;

import io.intellixity.unipage.api.Endpoints;
import io.intellixity.unipage.api.SelectHandler;
import io.intellixity.unipage.api.UnionHandler;
import io.intellixity.unipage.context.ContextualProvider;
import io.intellixity.unipage.examples.domain.Book;
import io.intellixity.unipage.examples.domain.BookFilter;
import io.intellixity.unipage.examples.domain.TableQuery;
import io.intellixity.unipage.examples.engine.Engines;
import io.intellixity.unipage.examples.web.CurrentUserFilter;
import io.intellixity.unipage.interceptors.AuthorizationInterceptor;
import io.intellixity.unipage.interceptors.CachingInterceptor;
import io.intellixity.unipage.interceptors.LoggingInterceptor;
import io.intellixity.unipage.mapping.RowMappingPolicy;
import io.intellixity.unipage.source.QueryParams;
import io.intellixity.unipage.source.QueryTemplate;
import io.intellixity.unipage.source.Source;
import io.intellixity.unipage.union.UnionOptions;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(UnipageProperties.class)
public class UnipageExampleConfig {
  static final String USER = "user";

  static final String BOOKS = "SELECT id, title, author, year FROM books ORDER BY id LIMIT ? OFFSET ?";
  static final String BOOKS_COUNT = "SELECT COUNT(*) FROM books";

  // ? IS NULL keeps optional filters in one statement; each value is bound twice
  static final String FILTERED = "SELECT id, title, author, year FROM books"
      + " WHERE (? IS NULL OR author = ?) AND (? IS NULL OR year >= ?) ORDER BY id LIMIT ? OFFSET ?";
  static final String FILTERED_COUNT = "SELECT COUNT(*) FROM books"
      + " WHERE (? IS NULL OR author = ?) AND (? IS NULL OR year >= ?)";

  @Bean
  public Engines engines(UnipageProperties props) {
    Engines engines = new Engines(props);
    LibrarySeeder.seed(engines, props);
    return engines;
  }

  @Bean
  public ContextualProvider currentUserProvider() {
    return ContextualProvider.of(USER, HttpServletRequest.class,
        r -> r.getAttribute(CurrentUserFilter.USER_ATTRIBUTE));
  }

  @Bean
  public LoggingInterceptor loggingInterceptor() {
    return new LoggingInterceptor(USER);
  }

  @Bean
  public SelectHandler<Map<String, Object>, Map<String, Object>> booksHandler(Engines engines,
                                                                              UnipageProperties props,
                                                                              LoggingInterceptor logging,
                                                                              ContextualProvider currentUserProvider) {
    Source<Map<String, Object>> source = Source.<Map<String, Object>>builder(primary(engines, props), engines.get(primary(engines, props)))
        .selectQuery(BOOKS)
        .countQuery(BOOKS_COUNT)
        .interceptor(new CachingInterceptor(500, Duration.ofSeconds(30), Duration.ZERO))
        .build();
    return Endpoints.single(source)
        .interceptor(logging)
        .contextualProvider(currentUserProvider)
        .build();
  }

  @Bean
  public SelectHandler<BookFilter, Book> typedBooksHandler(Engines engines,
                                                           UnipageProperties props,
                                                           LoggingInterceptor logging,
                                                           ContextualProvider currentUserProvider) {
    String id = primary(engines, props);
    return Endpoints.single(filteredBooks(id, engines))
        .rows(Book.class)
        .mappingPolicy(RowMappingPolicy.STRICT)
        .interceptor(logging)
        .contextualProvider(currentUserProvider)
        .build();
  }

  @Bean
  public SelectHandler<TableQuery, Map<String, Object>> tableQueryHandler(Engines engines,
                                                                          UnipageProperties props,
                                                                          LoggingInterceptor logging,
                                                                          ContextualProvider currentUserProvider) {
    String id = primary(engines, props);
    Source<TableQuery> source = Source.<TableQuery>builder(id, engines.get(id))
        .selectQuery(QueryTemplate.<TableQuery>of("SELECT * FROM __table__ ORDER BY __orderBy__ LIMIT ? OFFSET ?")
            .identifier("table", TableQuery::table)
            .identifier("orderBy", TableQuery::orderBy)
            .build())
        .countQuery(QueryTemplate.<TableQuery>of("SELECT COUNT(*) FROM __table__")
            .identifier("table", TableQuery::table)
            .build())
        .build();
    return Endpoints.single(source)
        .interceptor(logging)
        .interceptor(AuthorizationInterceptor.requiring(USER))
        .contextualProvider(currentUserProvider)
        .build();
  }

  @Bean
  public UnionHandler<BookFilter, Book> libraryHandler(Engines engines,
                                                       UnipageProperties props,
                                                       LoggingInterceptor logging,
                                                       ContextualProvider currentUserProvider) {
    List<Source<BookFilter>> sources = new ArrayList<>();
    for (String id : engines.ids()) sources.add(filteredBooks(id, engines));

    UnipageProperties.Union u = props.getUnion();
    return Endpoints.union(sources)
        .rows(Book.class)
        .defaultPriority(u.getPriority())
        .options(UnionOptions.builder()
            .timeout(u.getTimeout())
            .unknownTotalPolicy(u.getUnknownTotalPolicy())
            .build())
        .interceptor(logging)
        .contextualProvider(currentUserProvider)
        .build();
  }

  private static Source<BookFilter> filteredBooks(String id, Engines engines) {
    return Source.<BookFilter>builder(id, engines.get(id))
        .selectQuery(FILTERED)
        .countQuery(FILTERED_COUNT)
        .params(QueryParams.fields("author", "author", "minYear", "minYear"))
        .build();
  }

  private static String primary(Engines engines, UnipageProperties props) {
    String p = props.getPrimarySource();
    return (p == null || p.isBlank()) ? engines.ids().get(0) : p;
  }
}
