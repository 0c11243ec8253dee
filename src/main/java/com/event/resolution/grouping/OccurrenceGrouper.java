package com.event.resolution.grouping;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.LocationMatch;
import com.event.resolution.core.model.Occurrence;
import com.event.resolution.core.model.RawRow;
import com.event.resolution.core.model.ResolvedRow;
import com.event.resolution.metrics.MetricsService;
import com.event.resolution.metrics.NoOpMetricsService;
import com.event.resolution.text.EventNameMatcher;
import com.event.resolution.text.TimeStandardizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges the rows of one source file that describe the same event into one {@link Event}
 * with a list of occurrences.
 *
 * <p>Rows are processed in file order. A row joins the first existing group whose key equals
 * its name, or whose key is {@linkplain EventNameMatcher#areSimilar similar}; otherwise its
 * name opens a new group. The first row of a group supplies every non-date field; later rows
 * only contribute a shorter name, a new URL and a new occurrence.</p>
 */
public class OccurrenceGrouper {
    private static final Logger log = LoggerFactory.getLogger(OccurrenceGrouper.class);

    private static final List<String> CANCELLED_PREFIXES = List.of("CANCELED:", "CANCELLED:", "KIM:", "KIM -");
    private static final String NOT_APPLICABLE = "N/A";

    private final EventNameMatcher nameMatcher;
    private final MetricsService metrics;

    public OccurrenceGrouper() {
        this(new EventNameMatcher(), new NoOpMetricsService());
    }

    public OccurrenceGrouper(EventNameMatcher nameMatcher, MetricsService metrics) {
        this.nameMatcher = nameMatcher;
        this.metrics = metrics;
    }

    public List<Event> group(List<ResolvedRow> rows) {
        Map<String, Event> groups = new LinkedHashMap<>();
        Map<String, String> normalizedKeys = new LinkedHashMap<>();

        for (ResolvedRow resolved : rows) {
            RawRow row = resolved.row();
            String name = row.name();
            if (name.isEmpty()) {
                continue;
            }
            if (isCancelled(name)) {
                log.debug("Dropping cancelled listing '{}'", name);
                metrics.recordRowDropped(DropReason.CANCELLED);
                continue;
            }

            Occurrence occurrence = toOccurrence(row);
            String key = findGroupKey(name, normalizedKeys);
            Event event = groups.get(key);
            if (event == null) {
                event = newEvent(resolved, occurrence);
                groups.put(key, event);
                normalizedKeys.put(key, nameMatcher.normalize(key));
            } else {
                if (codePoints(name) < codePoints(event.getName())) {
                    event.setName(name);
                }
                event.addUrl(row.url().strip());
                event.addOccurrence(occurrence);
            }
        }
        return new ArrayList<>(groups.values());
    }

    private static int codePoints(String s) {
        return s.codePointCount(0, s.length());
    }

    static boolean isCancelled(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return CANCELLED_PREFIXES.stream().anyMatch(upper::startsWith);
    }

    private String findGroupKey(String name, Map<String, String> normalizedKeys) {
        if (normalizedKeys.containsKey(name)) {
            return name;
        }
        String normalized = nameMatcher.normalize(name);
        for (Map.Entry<String, String> existing : normalizedKeys.entrySet()) {
            if (nameMatcher.areNormalizedSimilar(normalized, existing.getValue())) {
                log.debug("Grouping '{}' with '{}'", name, existing.getKey());
                return existing.getKey();
            }
        }
        return name;
    }

    private static Event newEvent(ResolvedRow resolved, Occurrence occurrence) {
        RawRow row = resolved.row();
        Event.Builder builder = Event.builder()
                .name(row.name())
                .location(row.location())
                .description(row.description())
                .tags(resolved.tags())
                .emoji(resolved.emoji())
                .url(row.url().strip())
                .occurrence(occurrence);
        String sublocation = row.sublocation().strip();
        if (!sublocation.isEmpty() && !sublocation.equalsIgnoreCase(NOT_APPLICABLE)) {
            builder.sublocation(row.sublocation());
        }
        Event event = builder.build();
        LocationMatch location = resolved.location();
        if (location != null && location.lat() != null && location.lng() != null) {
            event.setCoordinates(location.lat(), location.lng());
        }
        return event;
    }

    static Occurrence toOccurrence(RawRow row) {
        String startDate = row.startDate();
        String endDate = row.endDate();
        if (!startDate.isEmpty() && startDate.equals(endDate)) {
            endDate = "";
        }
        return new Occurrence(startDate,
                TimeStandardizer.standardize(row.startTime()),
                endDate,
                TimeStandardizer.standardize(row.endTime()));
    }
}
