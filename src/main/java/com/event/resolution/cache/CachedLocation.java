package com.event.resolution.cache;

import com.event.resolution.core.model.LocationResolution;

import java.util.Optional;

/**
 * Cached outcome of one location lookup. An unresolved lookup is cached too,
 * with a null resolution.
 */
public record CachedLocation(LocationResolution resolution) {

    public static CachedLocation unresolved() {
        return new CachedLocation(null);
    }

    public Optional<LocationResolution> asOptional() {
        return Optional.ofNullable(resolution);
    }
}
