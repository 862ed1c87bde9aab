package io.intellixity.unipage.context;

import io.intellixity.unipage.error.RejectedException;
import io.intellixity.unipage.exec.QueryContext;
import io.intellixity.unipage.exec.QueryPhase;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ContextualValuesTest {

  @Test
  void cacheKeyIsOrderIndependent() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("user", "u1");
    a.put("tenant", "t1");
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("tenant", "t1");
    b.put("user", "u1");

    assertEquals(ContextualValues.of(a).cacheKey(), ContextualValues.of(b).cacheKey());
    assertNotEquals(ContextualValues.of(a).cacheKey(), ContextualValues.of(Map.of("user", "u2")).cacheKey());
  }

  @Test
  void cacheKeyTellsNullFromTheWordNull() {
    Map<String, Object> nullUser = new LinkedHashMap<>();
    nullUser.put("user", null);

    assertNotEquals(ContextualValues.of(nullUser).cacheKey(), ContextualValues.of(Map.of("user", "null")).cacheKey());
  }

  @Test
  void cacheKeyIsNotFooledBySeparatorsInValues() {
    Map<String, Object> two = new LinkedHashMap<>();
    two.put("a", "1");
    two.put("b", "2");
    Map<String, Object> one = Map.of("a", "1, b=2");

    assertNotEquals(ContextualValues.of(two).cacheKey(), ContextualValues.of(one).cacheKey());
  }

  @Test
  void cacheKeyTellsValueTypesApart() {
    assertNotEquals(ContextualValues.of(Map.of("tenant", 7)).cacheKey(),
        ContextualValues.of(Map.of("tenant", "7")).cacheKey());
  }

  @Test
  void explicitCacheKeyWins() {
    assertEquals("k", ContextualValues.of(Map.of("user", "u1"), "k").cacheKey());
  }

  @Test
  void distinguishesNullFromAbsent() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("user", null);
    ContextualValues v = ContextualValues.of(m);

    assertTrue(v.contains("user"));
    assertFalse(v.contains("tenant"));
    assertThrows(IllegalStateException.class, () -> v.getRequired("user"));
  }

  @Test
  void providersResolveInOrder() {
    List<ContextualProvider> providers = List.of(
        ContextualProvider.of("user", String.class, r -> r.toUpperCase()),
        ContextualProvider.of("length", String.class, String::length));

    ContextualValues v = ContextualProvider.resolveAll(providers, "abc");

    assertEquals("ABC", v.get("user"));
    assertEquals(3, v.get("length"));
    assertEquals(List.of("user", "length"), List.copyOf(v.asMap().keySet()));
  }

  @Test
  void providerRejectionPropagates() {
    ContextualProvider auth = ContextualProvider.of("user", String.class, r -> {
      throw new RejectedException(401, "missing credentials");
    });
    RejectedException e = assertThrows(RejectedException.class, () -> ContextualProvider.resolveAll(List.of(auth), "x"));
    assertEquals(401, e.status());
  }

  @Test
  void throwsOnWrongRequestType() {
    ContextualProvider p = ContextualProvider.of("user", String.class, r -> r);
    assertThrows(IllegalArgumentException.class, () -> p.resolve(42));
  }

  @Test
  void throwsOnDuplicateProviderKey() {
    ContextualProvider p = ContextualProvider.of("user", String.class, r -> r);
    assertThrows(IllegalArgumentException.class, () -> ContextualProvider.copyOf(List.of(p, p)));
  }

  @Test
  void derivedValuesCannotShadowResolvedOnes() {
    QueryContext ctx = new QueryContext("s", QueryPhase.SELECT, "q", List.of(), null, List.of(), null, 1, 0,
        ContextualValues.of(Map.of("user", "u1")));

    ctx.putDerived("role", "admin");
    assertEquals("admin", ctx.contextual("role"));
    assertEquals("u1", ctx.contextual("user"));
    assertThrows(IllegalStateException.class, () -> ctx.putDerived("user", "u2"));
  }
}
