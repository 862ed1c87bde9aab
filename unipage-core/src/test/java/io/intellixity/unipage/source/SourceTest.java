package io.intellixity.unipage.source;

import io.intellixity.unipage.StubEngine;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SourceTest {

  record BookFilters(String author, LocalDate since) {}

  public static final class BeanFilters {
    private String genre = "poetry";
    public String getGenre() { return genre; }
  }

  private static final StubEngine ENGINE = StubEngine.withRows("books", 0);

  @Test
  void defaultParams_filterValuesThenPage() {
    LocalDate since = LocalDate.of(2020, 1, 1);
    Source<BookFilters> s = Source.<BookFilters>builder("books", ENGINE)
        .selectQuery("select * from books where author = %s and published >= %s limit %s offset %s")
        .countQuery("select count(*) from books where author = %s and published >= %s")
        .params(QueryParams.fields("author", "since"))
        .build();

    BookFilters f = new BookFilters("Le Guin", since);
    assertEquals(List.of("Le Guin", since, 10, 20), s.selectParams(f, 10, 20));
    assertEquals(List.of("Le Guin", since), s.countParams(f));
  }

  @Test
  void defaultParams_withoutFilterParams() {
    Source<Void> s = Source.<Void>builder("books", ENGINE).selectQuery("select").build();

    assertEquals(List.of(5, 0), s.selectParams(null, 5, 0));
    assertEquals(List.of(), s.countParams(null));
    assertFalse(s.hasCount());
    assertNull(s.renderCount(null));
  }

  @Test
  void explicitSelectParamsWin() {
    Source<BookFilters> s = Source.<BookFilters>builder("books", ENGINE)
        .selectQuery("select")
        .params(QueryParams.fields("author"))
        .selectParams((f, limit, offset) -> List.of(offset, limit))
        .build();

    assertEquals(List.of(3, 2), s.selectParams(new BookFilters("x", null), 2, 3));
  }

  @Test
  void fieldsReadBeansAndMaps() {
    assertEquals(List.of("poetry"), QueryParams.<BeanFilters>fields("genre").params(new BeanFilters()));
    assertEquals(List.of(7), QueryParams.<Map<String, Object>>fields("n").params(Map.of("n", 7)));
  }

  @Test
  void throwsOnUnknownFilterField() {
    QueryException e = assertThrows(QueryException.class,
        () -> QueryParams.<BookFilters>fields("title").params(new BookFilters("a", null)));
    assertEquals(ErrorKind.INVALID_FILTER, e.kind());
  }

  @Test
  void throwsWhenSelectQueryMissing() {
    assertThrows(IllegalArgumentException.class, () -> Source.<Void>builder("books", ENGINE).build());
    assertThrows(IllegalArgumentException.class, () -> Source.<Void>builder(" ", ENGINE));
  }

  @Test
  void throwsWhenRenderedQueryBlank() {
    Source<Void> s = Source.<Void>builder("books", ENGINE).selectQuery(f -> " ").build();
    QueryException e = assertThrows(QueryException.class, () -> s.renderSelect(null));
    assertEquals(ErrorKind.INVALID_FILTER, e.kind());
  }
}
