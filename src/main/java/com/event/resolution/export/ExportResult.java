package com.event.resolution.export;

import java.util.List;

/**
 * Counts from one export run.
 *
 * @param eventsLoaded     events read from processed files
 * @param unreadableFiles  processed files skipped because they could not be parsed
 * @param duplicatesMerged events folded into a duplicate
 * @param filteredOut      events outside the window or carrying a remove tag
 * @param unlocatedDropped events left out for lack of coordinates
 * @param initEvents       events written to the init set
 * @param initLocations    locations written to the init set
 * @param fullEvents       events written to the full set
 * @param fullLocations    locations written to the full set
 */
public record ExportResult(
        long eventsLoaded,
        List<String> unreadableFiles,
        long duplicatesMerged,
        long filteredOut,
        long unlocatedDropped,
        long initEvents,
        long initLocations,
        long fullEvents,
        long fullLocations
) {
    public ExportResult {
        unreadableFiles = unreadableFiles != null ? List.copyOf(unreadableFiles) : List.of();
    }

    @Override
    public String toString() {
        return "ExportResult{loaded=" + eventsLoaded +
                ", unreadable=" + unreadableFiles.size() +
                ", merged=" + duplicatesMerged +
                ", filtered=" + filteredOut +
                ", unlocated=" + unlocatedDropped +
                ", init=" + initEvents + "/" + initLocations +
                ", full=" + fullEvents + "/" + fullLocations + '}';
    }
}
