package io.intellixity.unipage.union;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PriorityResolverTest {

  private static final List<String> DEFAULT = List.of("a", "b", "c");
  private static final List<String> REGISTERED = List.of("a", "b", "c");

  @Test
  void noOverride_keepsDefault() {
    assertEquals(DEFAULT, PriorityResolver.resolve(DEFAULT, REGISTERED, null));
    assertEquals(DEFAULT, PriorityResolver.resolve(DEFAULT, REGISTERED, "  "));
  }

  @Test
  void listedFirst_unlistedAppendedInRegistrationOrder() {
    assertEquals(List.of("c", "a", "b"), PriorityResolver.resolve(DEFAULT, REGISTERED, "c"));
    assertEquals(List.of("b", "a", "c"), PriorityResolver.resolve(DEFAULT, REGISTERED, "b,a"));
  }

  @Test
  void unlistedFollowRegistrationOrder_notConfiguredDefault() {
    List<String> configured = List.of("c", "b", "a");
    assertEquals(configured, PriorityResolver.resolve(configured, REGISTERED, null));
    assertEquals(List.of("b", "a", "c"), PriorityResolver.resolve(configured, REGISTERED, "b"));
  }

  @Test
  void trimsBlanksAndDuplicates() {
    assertEquals(List.of("c", "b", "a"), PriorityResolver.resolve(DEFAULT, REGISTERED, " c , ,b,c,"));
  }

  @Test
  void throwsOnUnknownSource() {
    QueryException e = assertThrows(QueryException.class, () -> PriorityResolver.resolve(DEFAULT, REGISTERED, "b,zzz"));
    assertEquals(ErrorKind.UNKNOWN_PRIORITY_SOURCE, e.kind());
    assertTrue(e.getMessage().contains("zzz"));
  }
}
