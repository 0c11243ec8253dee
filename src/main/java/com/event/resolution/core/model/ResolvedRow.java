package com.event.resolution.core.model;

import java.util.List;

/**
 * A sanitized, filtered row with its tags, venue and emoji resolved, ready for grouping.
 *
 * @param row      the sanitized table row
 * @param tags     normalized tags
 * @param location resolved venue, or null when unresolved
 * @param emoji    selected emoji, or null
 */
public record ResolvedRow(RawRow row, List<String> tags, LocationMatch location, String emoji) {

    public ResolvedRow {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
