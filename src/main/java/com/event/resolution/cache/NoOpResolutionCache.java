package com.event.resolution.cache;

import com.event.resolution.core.model.LocationQuery;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used as the default when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<CachedLocation> get(LocationQuery query) {
        return Optional.empty();
    }

    @Override
    public void put(LocationQuery query, CachedLocation lookup) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
