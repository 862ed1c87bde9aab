package io.intellixity.unipage.union;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.exec.Pagination;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pure window computation for a union request.\n
 *
 * Sources are laid end to end in priority order; the global {@code [offset, offset + limit)} slice is cut
 * out of that virtual sequence. Every source gets a window (possibly 0/0), in priority order.
 */
public final class UnionPaginationPlanner {
  private UnionPaginationPlanner() {}

  public static List<SourceWindow> plan(List<String> priority,
                                        Map<String, Long> totals,
                                        int limit,
                                        int offset,
                                        UnknownTotalPolicy policy) {
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(totals, "totals");
    Pagination.requireValid(limit, offset);
    UnknownTotalPolicy p = (policy == null) ? UnknownTotalPolicy.UNBOUNDED : policy;

    List<SourceWindow> out = new ArrayList<>(priority.size());
    long cursor = 0;
    long remaining = limit;
    for (String id : priority) {
      Long total = totals.get(id);
      if (total == null && p == UnknownTotalPolicy.REJECT) {
        throw new QueryException(ErrorKind.QUERY_EXECUTION,
            "Source '" + id + "' has no total; a count query is required for union pagination");
      }
      if (total != null && total < 0) {
        throw new QueryException(ErrorKind.QUERY_EXECUTION, "Source '" + id + "' reported a negative total: " + total);
      }

      if (remaining == 0) {
        out.add(new SourceWindow(id, 0, 0, total));
        continue;
      }
      if (total != null && cursor + total <= offset) {
        cursor += total;
        out.add(new SourceWindow(id, 0, 0, total));
        continue;
      }

      long fetchOffset = Math.max(0, offset - cursor);
      long fetchLimit = (total == null) ? remaining : Math.min(remaining, total - fetchOffset);
      remaining -= fetchLimit;
      cursor += fetchOffset + fetchLimit;
      out.add(new SourceWindow(id, (int) fetchLimit, (int) fetchOffset, total));
    }
    return List.copyOf(out);
  }
}
