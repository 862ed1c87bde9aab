package io.intellixity.unipage.exec;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;

public final class Pagination {
  private Pagination() {}

  public static void requireValid(int limit, int offset) {
    if (limit < 0) throw new QueryException(ErrorKind.INVALID_PAGINATION, "limit must be >= 0 but was " + limit);
    if (offset < 0) throw new QueryException(ErrorKind.INVALID_PAGINATION, "offset must be >= 0 but was " + offset);
  }
}
