package com.event.resolution.merge;

import com.event.resolution.core.model.Event;

import java.util.List;

/**
 * Outcome of a cross-batch dedup pass.
 *
 * @param events      surviving events, in first-seen group order
 * @param mergedCount number of events folded into an earlier duplicate
 */
public record DedupResult(List<Event> events, int mergedCount) {

    public DedupResult {
        events = List.copyOf(events);
    }
}
