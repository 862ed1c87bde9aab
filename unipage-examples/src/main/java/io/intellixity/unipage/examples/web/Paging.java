package io.intellixity.unipage.examples.web;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.examples.config.UnipageProperties;
import org.springframework.stereotype.Component;

/**
 * HTTP-level window validation: a page must ask for at least one row.
 * The core itself accepts {@code limit = 0}.
 */
@Component
public final class Paging {
  private final int defaultLimit;

  public Paging(UnipageProperties props) {
    if (props.getDefaultLimit() < 1) throw new IllegalArgumentException("unipage.default-limit must be >= 1");
    this.defaultLimit = props.getDefaultLimit();
  }

  public int limit(Integer requested) {
    if (requested == null) return defaultLimit;
    if (requested < 1) throw new QueryException(ErrorKind.INVALID_PAGINATION, "limit must be >= 1, got " + requested);
    return requested;
  }

  public int offset(Integer requested) {
    if (requested == null) return 0;
    if (requested < 0) throw new QueryException(ErrorKind.INVALID_PAGINATION, "offset must be >= 0, got " + requested);
    return requested;
  }
}
