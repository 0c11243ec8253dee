package com.event.resolution.api;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.Event;

import java.util.List;
import java.util.Map;

/**
 * Events produced from one extracted table, with the reasons rows were dropped.
 *
 * @param sourceFileName the extracted file the table came from
 * @param events         finalized events in first-seen order
 * @param rowsParsed     rows the table parser accepted
 * @param dropped        dropped row counts by reason
 * @param unresolved     rows whose venue could not be resolved
 */
public record FileProcessingResult(
        String sourceFileName,
        List<Event> events,
        int rowsParsed,
        Map<DropReason, Integer> dropped,
        int unresolved
) {
    public FileProcessingResult {
        events = List.copyOf(events);
        dropped = Map.copyOf(dropped);
    }

    public int droppedCount() {
        return dropped.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "FileProcessingResult{source=" + sourceFileName +
                ", events=" + events.size() +
                ", rows=" + rowsParsed +
                ", dropped=" + dropped +
                ", unresolved=" + unresolved + '}';
    }
}
