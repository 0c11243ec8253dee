package com.event.resolution.cache;

import com.event.resolution.core.model.LocationMatch;
import com.event.resolution.core.model.LocationQuery;
import com.event.resolution.core.model.LocationResolution;
import com.event.resolution.core.model.MatchKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCacheTest {

    private static CachedLocation resolved(String key) {
        return new CachedLocation(LocationResolution.exact(
                new LocationMatch(40.7284, -74.0044, null), key, MatchKind.EXACT_LOCATION));
    }

    @Nested
    @DisplayName("NoOpResolutionCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpResolutionCache cache = new NoOpResolutionCache();
            cache.put(LocationQuery.of("Film Forum", ""), resolved("film forum"));
            assertTrue(cache.get(LocationQuery.of("Film Forum", "")).isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = new NoOpResolutionCache().getStats();
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(0, stats.size());
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineResolutionCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache and retrieve lookups")
        void testPutAndGet() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            LocationQuery query = new LocationQuery("Film Forum", "Theater 1", "film forum", "Jaws");

            cache.put(query, resolved("film forum"));
            Optional<CachedLocation> cached = cache.get(
                    new LocationQuery("Film Forum", "Theater 1", "film forum", "Jaws"));

            assertTrue(cached.isPresent());
            assertEquals("film forum", cached.get().resolution().matchedKey());
        }

        @Test
        @DisplayName("Should cache unresolved lookups")
        void testUnresolvedCached() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            LocationQuery query = LocationQuery.of("Somewhere", "");

            cache.put(query, CachedLocation.unresolved());

            Optional<CachedLocation> cached = cache.get(query);
            assertTrue(cached.isPresent());
            assertTrue(cached.get().asOptional().isEmpty());
        }

        @Test
        @DisplayName("Should key on the whole query")
        void testKeyIncludesContext() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(new LocationQuery("Online", "", "oculus", "Jaws"), resolved("oculus"));

            assertTrue(cache.get(new LocationQuery("Online", "", "film forum", "Jaws")).isEmpty());
            assertTrue(cache.get(new LocationQuery("Online", "", "oculus", "Alien")).isEmpty());
        }

        @Test
        @DisplayName("Should invalidate all entries")
        void testInvalidateAll() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(LocationQuery.of("Film Forum", ""), resolved("film forum"));
            cache.put(LocationQuery.of("Oculus", ""), resolved("oculus"));

            cache.invalidateAll();

            assertTrue(cache.get(LocationQuery.of("Film Forum", "")).isEmpty());
            assertTrue(cache.get(LocationQuery.of("Oculus", "")).isEmpty());
        }

        @Test
        @DisplayName("Should report cache stats")
        void testCacheStats() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(LocationQuery.of("Film Forum", ""), resolved("film forum"));

            cache.get(LocationQuery.of("Film Forum", "")); // hit
            cache.get(LocationQuery.of("Missing", "")); // miss

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 0.001);
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should create a Caffeine cache when enabled")
        void testCreateEnabled() {
            assertInstanceOf(CaffeineResolutionCache.class, CacheConfig.defaults().createCache());
        }

        @Test
        @DisplayName("Should create a no-op cache when disabled")
        void testCreateDisabled() {
            assertInstanceOf(NoOpResolutionCache.class, CacheConfig.disabled().createCache());
        }

        @Test
        @DisplayName("Should reject non-positive limits")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(100, 0, true));
        }
    }
}
