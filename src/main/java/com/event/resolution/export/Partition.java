package com.event.resolution.export;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.LocationEntry;

import java.util.List;

/**
 * The init/full split of the published dataset with the registry entries each half uses.
 * No coordinate appears in both location lists.
 */
public record Partition(List<Event> initEvents, List<LocationEntry> initLocations,
                        List<Event> fullEvents, List<LocationEntry> fullLocations) {

    public Partition {
        initEvents = List.copyOf(initEvents);
        initLocations = List.copyOf(initLocations);
        fullEvents = List.copyOf(fullEvents);
        fullLocations = List.copyOf(fullLocations);
    }
}
