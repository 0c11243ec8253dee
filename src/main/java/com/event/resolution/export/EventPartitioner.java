package com.event.resolution.export;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.LocationEntry;
import com.event.resolution.text.IsoDates;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits events into the init set (inside the bounding box and starting within the init
 * window) and the full set (everything else), and derives each set's registry locations.
 */
public class EventPartitioner {

    static final String MISSING_DATE_SENTINEL = "9999-99-99";

    private final ExportOptions options;
    private final Clock clock;

    public EventPartitioner(ExportOptions options, Clock clock) {
        this.options = options;
        this.clock = clock;
    }

    /**
     * Stable sort by first occurrence start date; events without one go last.
     */
    public static List<Event> sortByFirstStartDate(List<Event> events) {
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(e -> e.firstStartDate().orElse(MISSING_DATE_SENTINEL)));
        return sorted;
    }

    public Partition partition(List<Event> events, List<LocationEntry> registry) {
        LocalDate initLimit = LocalDate.now(clock).plusDays(options.getInitDays());
        List<Event> init = new ArrayList<>();
        List<Event> full = new ArrayList<>();
        for (Event event : events) {
            if (isInitEvent(event, initLimit)) {
                init.add(event);
            } else {
                full.add(event);
            }
        }

        List<LocationEntry> initLocations = activeLocations(init, registry, Set.of());
        Set<CoordinateKey> initCoordinates = coordinatesOf(initLocations);
        List<LocationEntry> fullLocations = activeLocations(full, registry, initCoordinates);
        return new Partition(init, initLocations, full, fullLocations);
    }

    boolean isInitEvent(Event event, LocalDate initLimit) {
        if (!event.hasCoordinates()
                || !options.getInitBoundingBox().contains(event.getLat(), event.getLng())) {
            return false;
        }
        Optional<LocalDate> start = event.firstStartDate().flatMap(IsoDates::parse);
        return start.isPresent() && start.get().isBefore(initLimit);
    }

    private List<LocationEntry> activeLocations(List<Event> events, List<LocationEntry> registry,
                                                Set<CoordinateKey> excluded) {
        Set<CoordinateKey> active = new HashSet<>();
        for (Event event : events) {
            if (event.hasCoordinates()) {
                active.add(key(event.getLat(), event.getLng()));
            }
        }
        List<LocationEntry> result = new ArrayList<>();
        for (LocationEntry entry : registry) {
            if (!entry.hasCoordinates()) {
                continue;
            }
            CoordinateKey key = key(entry.getLat(), entry.getLng());
            if (active.contains(key) && !excluded.contains(key)) {
                result.add(entry);
            }
        }
        return result;
    }

    private Set<CoordinateKey> coordinatesOf(List<LocationEntry> entries) {
        Set<CoordinateKey> keys = new HashSet<>();
        for (LocationEntry entry : entries) {
            keys.add(key(entry.getLat(), entry.getLng()));
        }
        return keys;
    }

    private CoordinateKey key(double lat, double lng) {
        return CoordinateKey.of(lat, lng, options.getCoordinateScale());
    }
}
