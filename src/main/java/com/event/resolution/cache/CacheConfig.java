package com.event.resolution.cache;

/**
 * Configuration for the location resolution cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries, 3600s TTL, enabled.
     * Registry data does not change during a run, so entries only age out between runs.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3600, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    /**
     * Builds the cache this configuration describes.
     */
    public ResolutionCache createCache() {
        return enabled ? new CaffeineResolutionCache(this) : new NoOpResolutionCache();
    }
}
