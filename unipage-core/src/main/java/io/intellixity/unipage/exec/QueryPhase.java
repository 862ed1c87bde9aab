package io.intellixity.unipage.exec;

/** What the terminal of an interceptor chain will execute for a given context. */
public enum QueryPhase {
  /** Rows only (union select phase; totals were obtained separately). */
  SELECT,
  /** Total only (union count phase). */
  COUNT,
  /** Rows plus total when a count query is configured (single-source request). */
  SELECT_AND_COUNT;

  public boolean selects() {
    return this != COUNT;
  }

  public boolean counts() {
    return this != SELECT;
  }
}
