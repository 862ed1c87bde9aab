package io.intellixity.unipage.mapping;

/** What a failed row mapping does to the source it came from. */
public enum RowMappingPolicy {
  /** Fail the whole source with {@code ROW_MAPPING}; pagination accounting stays exact. */
  STRICT,
  /** Drop the row and log it; the page comes back short by that row. */
  LENIENT
}
