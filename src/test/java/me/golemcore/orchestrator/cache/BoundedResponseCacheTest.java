package me.golemcore.orchestrator.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedResponseCacheTest {

    private BoundedResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        cache = new BoundedResponseCache<>("test", 3);
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedResponseCache<String>("bad", 0));
    }

    @Test
    void shouldRejectNullValue() {
        assertThrows(NullPointerException.class, () -> cache.set("a", null));

        assertFalse(cache.has("a"));
        assertEquals(0, cache.size());
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntryWhenFull() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        cache.get("a");
        cache.set("d", "4");

        assertEquals(3, cache.size());
        assertFalse(cache.has("b"));
        assertTrue(cache.has("a"));
        assertEquals(List.of("c", "a", "d"), cache.keys());
        assertEquals(1, cache.getStats().evictions());
    }

    @Test
    void shouldNotRefreshRecencyOnHas() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        assertTrue(cache.has("a"));
        cache.set("d", "4");

        assertFalse(cache.has("a"));
    }

    @Test
    void shouldRefreshRecencyWhenOverwritingExistingKey() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        cache.set("a", "updated");
        cache.set("d", "4");

        assertEquals(Optional.of("updated"), cache.get("a"));
        assertFalse(cache.has("b"));
    }

    @Test
    void shouldCountHitsAndMisses() {
        cache.set("a", "1");

        cache.get("a");
        cache.get("missing");
        cache.get("missing");

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(1, stats.size());
        assertEquals(3, stats.maxSize());
        assertEquals(1.0 / 3, stats.usage(), 0.0001);
    }

    @Test
    void shouldDeleteAndClear() {
        cache.set("a", "1");
        cache.set("b", "2");

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void cachedResponseShouldExpireAfterTtl() {
        Instant cachedAt = Instant.parse("2026-03-01T10:00:00Z");
        CachedResponse response = new CachedResponse("text", "gpt-4o", cachedAt);

        assertTrue(response.isFresh(cachedAt.plusSeconds(59), Duration.ofMinutes(1)));
        assertFalse(response.isFresh(cachedAt.plusSeconds(60), Duration.ofMinutes(1)));
    }
}
