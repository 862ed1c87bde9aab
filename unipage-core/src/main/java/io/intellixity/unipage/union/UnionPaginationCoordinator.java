package io.intellixity.unipage.union;

import io.intellixity.unipage.context.ContextualValues;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.exec.Pagination;
import io.intellixity.unipage.exec.Result;
import io.intellixity.unipage.exec.SingleSourceExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Serves one page over several sources treated as a single ordered sequence.\n
 *
 * 1. count every source (in parallel)\n
 * 2. plan per-source windows with {@link UnionPaginationPlanner}\n
 * 3. select every non-empty window (in parallel)\n
 * 4. concatenate in priority order\n
 *
 * Any failure fails the whole request; partial pages are never returned.
 */
public final class UnionPaginationCoordinator<F, T> {
  private static final Logger log = LoggerFactory.getLogger(UnionPaginationCoordinator.class);

  private final Map<String, SingleSourceExecutor<F, T>> executors;
  private final List<String> defaultPriority;
  private final List<String> registrationOrder;
  private final UnionOptions options;

  public UnionPaginationCoordinator(List<SingleSourceExecutor<F, T>> executors,
                                    List<String> defaultPriority,
                                    UnionOptions options) {
    Objects.requireNonNull(executors, "executors");
    if (executors.isEmpty()) throw new IllegalArgumentException("union needs at least one source");
    Map<String, SingleSourceExecutor<F, T>> byId = new LinkedHashMap<>();
    for (SingleSourceExecutor<F, T> e : executors) {
      String id = Objects.requireNonNull(e, "executor").source().id();
      if (byId.putIfAbsent(id, e) != null) throw new IllegalArgumentException("Duplicate source id: " + id);
    }
    this.executors = byId;
    this.registrationOrder = List.copyOf(byId.keySet());
    this.defaultPriority = completePriority(defaultPriority, byId);
    this.options = (options == null) ? UnionOptions.defaults() : options;
  }

  public List<String> defaultPriority() {
    return defaultPriority;
  }

  public UnionOptions options() {
    return options;
  }

  public Result<T> handle(F filters, int limit, int offset, String priorityOverride, ContextualValues values) {
    Pagination.requireValid(limit, offset);
    List<String> priority = PriorityResolver.resolve(defaultPriority, registrationOrder, priorityOverride);
    Duration timeout = options.timeout();
    long deadline = (timeout == null) ? 0L : System.nanoTime() + timeout.toNanos();

    List<Callable<Long>> counts = new ArrayList<>(priority.size());
    for (String id : priority) {
      SingleSourceExecutor<F, T> ex = executors.get(id);
      counts.add(() -> ex.count(filters, values));
    }
    List<Long> totalsInOrder = FanOut.all(options.executor(), counts, timeout, "count");
    Map<String, Long> totals = new HashMap<>();
    for (int i = 0; i < priority.size(); i++) totals.put(priority.get(i), totalsInOrder.get(i));

    List<SourceWindow> windows = UnionPaginationPlanner.plan(priority, totals, limit, offset, options.unknownTotalPolicy());
    if (log.isDebugEnabled()) {
      log.debug("unipage.union op=plan limit={} offset={} priority={} windows={}", limit, offset, priority, summarize(windows));
    }

    List<SourceWindow> fetching = new ArrayList<>();
    List<Callable<Result<T>>> selects = new ArrayList<>();
    for (SourceWindow w : windows) {
      if (!w.fetches()) continue;
      SingleSourceExecutor<F, T> ex = executors.get(w.sourceId());
      fetching.add(w);
      selects.add(() -> ex.select(filters, w.fetchLimit(), w.fetchOffset(), values));
    }
    List<Result<T>> pages = FanOut.all(options.executor(), selects, remaining(timeout, deadline, selects.isEmpty()), "select");

    List<T> data = new ArrayList<>();
    for (Result<T> page : pages) data.addAll(page.data());
    Long total = grandTotal(totalsInOrder);

    if (log.isDebugEnabled()) {
      log.debug("unipage.union op=done sources={} fetched={} rows={} total={}", priority.size(), fetching.size(), data.size(), total);
    }
    return Result.of(data, total);
  }

  // The timeout bounds the whole request, so the select phase only gets what the count phase left.
  private static Duration remaining(Duration timeout, long deadline, boolean nothingToRun) {
    if (timeout == null || nothingToRun) return timeout;
    long left = deadline - System.nanoTime();
    if (left <= 0) {
      throw new QueryException(ErrorKind.ENGINE_CONNECTIVITY, "Union select timed out after " + timeout);
    }
    return Duration.ofNanos(left);
  }

  private static Long grandTotal(List<Long> totals) {
    long sum = 0;
    for (Long t : totals) {
      if (t == null) return null;
      sum += t;
    }
    return sum;
  }

  private static <E> List<String> completePriority(List<String> configured, Map<String, E> byId) {
    List<String> out = new ArrayList<>();
    if (configured != null) {
      for (String raw : configured) {
        String id = Objects.requireNonNull(raw, "priority entry").trim();
        if (!byId.containsKey(id)) throw new IllegalArgumentException("Default priority references unknown source: " + id);
        if (out.contains(id)) throw new IllegalArgumentException("Default priority lists source twice: " + id);
        out.add(id);
      }
    }
    for (String id : byId.keySet()) if (!out.contains(id)) out.add(id);
    return List.copyOf(out);
  }

  private static String summarize(List<SourceWindow> windows) {
    StringBuilder sb = new StringBuilder("[");
    for (SourceWindow w : windows) {
      if (sb.length() > 1) sb.append(", ");
      sb.append(w.sourceId()).append(':').append(w.fetchOffset()).append('+').append(w.fetchLimit())
          .append("/").append(w.total() == null ? "?" : w.total());
    }
    return sb.append(']').toString();
  }
}
