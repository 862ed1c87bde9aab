package io.intellixity.unipage.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Page of rows plus the total row count behind it.
 * <p>
 * {@code total} is null when it is unknown (no count query), which is distinct from zero.
 */
public record Result<T>(List<T> data, Long total) {
  public Result {
    data = (data == null || data.isEmpty()) ? List.of() : Collections.unmodifiableList(new ArrayList<>(data));
  }

  public static <T> Result<T> of(List<T> data, Long total) {
    return new Result<>(data, total);
  }

  /** No rows; total as given (may be null). */
  public static <T> Result<T> empty(Long total) {
    return new Result<>(List.of(), total);
  }

  public boolean totalKnown() {
    return total != null;
  }

  public <R> Result<R> map(Function<? super T, ? extends R> fn) {
    List<R> out = new ArrayList<>(data.size());
    for (T t : data) out.add(fn.apply(t));
    return new Result<>(out, total);
  }
}
