package io.intellixity.unipage.examples.domain;

/** Optional filters; a null field does not constrain the result. */
public record BookFilter(String author, Integer minYear) {
  public static final BookFilter NONE = new BookFilter(null, null);
}
