package com.event.resolution.core.model;

import java.util.Objects;

/**
 * Result of resolving an event's venue against the location index.
 *
 * @param location   the matched coordinate/emoji projection
 * @param matchedKey the index key that won
 * @param kind       the cascade step that produced the match
 * @param score      1.0 for exact steps, the winning candidate score otherwise
 */
public record LocationResolution(LocationMatch location, String matchedKey, MatchKind kind, double score) {

    public LocationResolution {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public static LocationResolution exact(LocationMatch location, String key, MatchKind kind) {
        return new LocationResolution(location, key, kind, 1.0);
    }
}
