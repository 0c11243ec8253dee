package com.event.resolution.cache;

import com.event.resolution.core.model.LocationQuery;

import java.util.Optional;

/**
 * Cache interface for location resolution results.
 * Keyed by the full raw query, so a hit always returns what a fresh lookup would.
 */
public interface ResolutionCache {

    /**
     * Gets a cached lookup.
     *
     * @param query the raw location query
     * @return the cached lookup, or empty if the query was never cached
     */
    Optional<CachedLocation> get(LocationQuery query);

    /**
     * Caches the outcome of a lookup, resolved or not.
     */
    void put(LocationQuery query, CachedLocation lookup);

    /**
     * Invalidates all cache entries, e.g. after the registry was reloaded.
     */
    void invalidateAll();

    CacheStats getStats();
}
