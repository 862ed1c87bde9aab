package io.intellixity.unipage.union;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class UnionPaginationPlannerTest {

  private static final List<String> PRIORITY = List.of("s1", "s2", "s3");

  private static Map<String, Long> totals(long a, long b, long c) {
    Map<String, Long> m = new LinkedHashMap<>();
    m.put("s1", a);
    m.put("s2", b);
    m.put("s3", c);
    return m;
  }

  @Test
  void skipsFirstSourceAndSpillsIntoThird() {
    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, totals(3, 4, 5), 5, 3, UnknownTotalPolicy.UNBOUNDED);

    assertEquals(new SourceWindow("s1", 0, 0, 3L), w.get(0));
    assertEquals(new SourceWindow("s2", 4, 0, 4L), w.get(1));
    assertEquals(new SourceWindow("s3", 1, 0, 5L), w.get(2));
  }

  @Test
  void offsetEqualToCumulativeTotal_startsNextSourceAtZero() {
    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, totals(3, 4, 5), 2, 7, UnknownTotalPolicy.UNBOUNDED);

    assertEquals(0, w.get(0).fetchLimit());
    assertEquals(0, w.get(1).fetchLimit());
    assertEquals(2, w.get(2).fetchLimit());
    assertEquals(0, w.get(2).fetchOffset());
  }

  @Test
  void offsetInsideSource_usesRelativeOffset() {
    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, totals(3, 4, 5), 3, 5, UnknownTotalPolicy.UNBOUNDED);

    assertEquals(new SourceWindow("s2", 2, 2, 4L), w.get(1));
    assertEquals(new SourceWindow("s3", 1, 0, 5L), w.get(2));
  }

  @Test
  void zeroLimit_fetchesNothing() {
    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, totals(3, 4, 5), 0, 0, UnknownTotalPolicy.UNBOUNDED);

    assertEquals(3, w.size());
    for (SourceWindow sw : w) {
      assertEquals(0, sw.fetchLimit());
      assertFalse(sw.fetches());
    }
  }

  @Test
  void offsetBeyondEverything_fetchesNothing() {
    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, totals(3, 4, 5), 10, 50, UnknownTotalPolicy.UNBOUNDED);
    assertTrue(w.stream().noneMatch(SourceWindow::fetches));
  }

  @Test
  void emptySourcesAreSkipped() {
    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, totals(0, 0, 5), 3, 1, UnknownTotalPolicy.UNBOUNDED);
    assertEquals(new SourceWindow("s3", 3, 1, 5L), w.get(2));
  }

  @Test
  void windowsAlwaysMatchTheGlobalSlice() {
    long[][] shapes = { {3, 4, 5}, {0, 0, 0}, {1, 0, 7}, {10, 1, 1}, {2, 2, 2} };
    for (long[] shape : shapes) {
      List<String> all = new ArrayList<>();
      for (int s = 0; s < 3; s++) for (int r = 0; r < shape[s]; r++) all.add(PRIORITY.get(s) + "-r" + (r + 1));

      for (int limit = 0; limit <= 14; limit++) {
        for (int offset = 0; offset <= 14; offset++) {
          List<SourceWindow> windows = UnionPaginationPlanner.plan(
              PRIORITY, totals(shape[0], shape[1], shape[2]), limit, offset, UnknownTotalPolicy.UNBOUNDED);

          int sum = 0;
          List<String> fetched = new ArrayList<>();
          for (int s = 0; s < 3; s++) {
            SourceWindow w = windows.get(s);
            sum += w.fetchLimit();
            for (int r = w.fetchOffset(); r < w.fetchOffset() + w.fetchLimit(); r++) {
              fetched.add(PRIORITY.get(s) + "-r" + (r + 1));
            }
          }
          int from = Math.min(offset, all.size());
          int to = Math.min(offset + limit, all.size());
          assertTrue(sum <= limit, "sum " + sum + " > limit " + limit);
          assertEquals(all.subList(from, to), fetched, "limit=" + limit + " offset=" + offset);
        }
      }
    }
  }

  @Test
  void unknownTotal_absorbsRemainingBudget() {
    Map<String, Long> t = totals(3, 4, 5);
    t.put("s2", null);

    List<SourceWindow> w = UnionPaginationPlanner.plan(PRIORITY, t, 5, 1, UnknownTotalPolicy.UNBOUNDED);

    assertEquals(new SourceWindow("s1", 2, 1, 3L), w.get(0));
    assertEquals(new SourceWindow("s2", 3, 0, null), w.get(1));
    assertEquals(0, w.get(2).fetchLimit());
  }

  @Test
  void unknownTotal_rejectedWhenConfigured() {
    Map<String, Long> t = totals(3, 4, 5);
    t.put("s3", null);

    QueryException e = assertThrows(QueryException.class,
        () -> UnionPaginationPlanner.plan(PRIORITY, t, 5, 0, UnknownTotalPolicy.REJECT));
    assertEquals(ErrorKind.QUERY_EXECUTION, e.kind());
  }

  @Test
  void throwsOnNegativePagination() {
    QueryException e = assertThrows(QueryException.class,
        () -> UnionPaginationPlanner.plan(PRIORITY, totals(1, 1, 1), 1, -1, UnknownTotalPolicy.UNBOUNDED));
    assertEquals(ErrorKind.INVALID_PAGINATION, e.kind());
  }
}
