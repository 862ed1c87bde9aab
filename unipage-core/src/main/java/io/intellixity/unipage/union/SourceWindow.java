package io.intellixity.unipage.union;

import java.util.Objects;

/**
 * Rows to pull from one source for one union request.
 * {@code total} is null when the source could not report one.
 */
public record SourceWindow(String sourceId, int fetchLimit, int fetchOffset, Long total) {
  public SourceWindow {
    Objects.requireNonNull(sourceId, "sourceId");
    if (fetchLimit < 0) throw new IllegalArgumentException("fetchLimit < 0: " + fetchLimit);
    if (fetchOffset < 0) throw new IllegalArgumentException("fetchOffset < 0: " + fetchOffset);
  }

  public boolean fetches() {
    return fetchLimit > 0;
  }
}
