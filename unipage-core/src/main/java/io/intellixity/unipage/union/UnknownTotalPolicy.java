package io.intellixity.unipage.union;

/** What the planner does with a source whose total is unknown (no count query). */
public enum UnknownTotalPolicy {
  /** Treat the source as able to absorb the whole remaining budget. */
  UNBOUNDED,
  /** Fail the union request; every source must be countable. */
  REJECT
}
