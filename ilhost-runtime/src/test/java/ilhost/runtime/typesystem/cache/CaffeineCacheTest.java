package ilhost.runtime.typesystem.cache;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 缓存功能测试
 */
public class CaffeineCacheTest {

    @Test
    public void testBasicOperations() {
        BoundedCache<String, Integer> cache = new CaffeineCache<>(100);

        Integer value = cache.computeIfAbsent("a", k -> 1);
        assertEquals(Integer.valueOf(1), value);
        assertEquals(Integer.valueOf(1), cache.get("a"));
        assertNull(cache.get("b"));

        cache.computeIfAbsent("b", k -> 2);
        assertEquals(2L, cache.size());
    }

    @Test
    public void testComputeIfAbsentDoesNotRecompute() {
        BoundedCache<Integer, Integer> cache = new CaffeineCache<>(100);

        assertEquals(Integer.valueOf(10), cache.computeIfAbsent(1, k -> k * 10));
        assertEquals(Integer.valueOf(10), cache.computeIfAbsent(1, k -> k * 20));
    }

    @Test
    public void testEviction() {
        CaffeineCache<Integer, String> cache = new CaffeineCache<>(3);
        for (int i = 0; i < 50; i++) {
            cache.computeIfAbsent(i, String::valueOf);
        }
        cache.cleanUp();

        assertTrue(cache.size() <= 3, "Cache size should respect the limit after maintenance");
        assertTrue(cache.getStats().getEvictionCount() > 0);
    }

    @Test
    public void testStats() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent("a", k -> "A");  // miss
        cache.get("a");  // hit
        cache.get("b");  // miss

        CacheStats stats = cache.getStats();
        assertEquals(1L, stats.getHitCount());
        assertEquals(2L, stats.getMissCount());
        assertEquals(100L, stats.getMaximumSize());
        assertEquals(1.0 / 3.0, stats.getHitRate(), 0.01);
    }

    @Test
    public void testClear() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent("a", k -> "A");
        cache.computeIfAbsent("b", k -> "B");
        assertEquals(2L, cache.size());

        cache.clear();
        assertEquals(0L, cache.size());
        assertNull(cache.get("a"));
    }

    @Test
    public void testNullHandling() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        assertNull(cache.get("missing"));
        // Caffeine 不缓存 null
        assertNull(cache.computeIfAbsent("key", k -> null));
        assertEquals(0L, cache.size());
    }

    @Test
    public void testRejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, String>(0));
    }
}
