package io.github.cyfko.eqschema.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedLRUCache Tests")
class BoundedLRUCacheTest {

    @Test
    @DisplayName("Least recently used entry is evicted")
    void testEviction() {
        BoundedLRUCache<String, String> cache = new BoundedLRUCache<>(2);
        cache.put("a", "1");
        cache.put("b", "2");

        // Touch "a" so that "b" becomes eldest
        assertEquals("1", cache.get("a"));
        cache.put("c", "3");

        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("computeIfAbsent computes once per key")
    void testComputeIfAbsent() {
        BoundedLRUCache<String, String> cache = new BoundedLRUCache<>(10);
        AtomicInteger calls = new AtomicInteger();

        assertEquals("X", cache.computeIfAbsent("x", k -> { calls.incrementAndGet(); return "X"; }));
        assertEquals("X", cache.computeIfAbsent("x", k -> { calls.incrementAndGet(); return "Y"; }));

        assertEquals(1, calls.get());
        assertEquals(1, cache.getHitCount());
        assertEquals(1, cache.getMissCount());
    }

    @Test
    @DisplayName("Failed computation is not cached")
    void testFailedComputation() {
        BoundedLRUCache<String, String> cache = new BoundedLRUCache<>(10);

        assertThrows(IllegalStateException.class,
                () -> cache.computeIfAbsent("x", k -> { throw new IllegalStateException("boom"); }));
        assertFalse(cache.containsKey("x"));
    }

    @Test
    @DisplayName("Clear empties the cache")
    void testClear() {
        BoundedLRUCache<String, String> cache = new BoundedLRUCache<>(10);
        cache.put("a", "1");

        cache.clear();

        assertEquals(0, cache.size());
        assertNull(cache.get("a"));
        assertEquals("BoundedLRUCache[size=0, maxSize=10, hits=0, misses=1]", cache.getStats());
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<String, String>(0));
        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<String, String>(1).put("a", null));
    }
}
