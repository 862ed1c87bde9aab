package io.intellixity.unipage.interceptors.internal;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class LruTtlCacheTest {

  @Test
  void evictsLeastRecentlyUsed() {
    LruTtlCache<String, Integer> c = new LruTtlCache<>(2, 0, 0);
    c.put("a", 1);
    c.put("b", 2);
    assertEquals(1, c.get("a"));
    c.put("c", 3);

    assertNull(c.get("b"));
    assertEquals(1, c.get("a"));
    assertEquals(3, c.get("c"));
  }

  @Test
  void ttl_and_idleExpiry() {
    AtomicLong now = new AtomicLong();
    LruTtlCache<String, Integer> ttl = new LruTtlCache<>(10, 100, 0, now::get);
    LruTtlCache<String, Integer> idle = new LruTtlCache<>(10, 0, 50, now::get);
    ttl.put("k", 1);
    idle.put("k", 1);

    now.set(40);
    assertEquals(1, ttl.get("k"));
    assertEquals(1, idle.get("k"));
    now.set(80);
    assertEquals(1, idle.get("k"));
    now.set(100);
    assertNull(ttl.get("k"));
    assertEquals(1, idle.get("k"));
    now.set(150);
    assertNull(idle.get("k"));
  }

  @Test
  void rejectsInvalidConfig() {
    assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(0, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(1, -1, 0));
  }
}
