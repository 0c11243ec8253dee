package com.event.resolution.merge;

import com.event.resolution.core.model.Event;
import com.event.resolution.metrics.MetricsService;
import com.event.resolution.metrics.NoOpMetricsService;
import com.event.resolution.text.EventNameMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges near-duplicate events that arrive from different source files.
 *
 * <p>Events are bucketed by exact {@code (lat, lng, first start date)}. Within a bucket each
 * event is compared, in order, with the survivors so far and merges into the first one whose
 * name is {@linkplain EventNameMatcher#areSimilar similar}. The merged event keeps the shorter
 * name, or on equal length the longer description, and the union of both URL lists with the
 * earlier event's URLs first. Events without coordinates or occurrences are passed through
 * untouched in their original position.</p>
 */
public class CrossBatchDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(CrossBatchDeduplicator.class);

    private final EventNameMatcher nameMatcher;
    private final MetricsService metrics;

    public CrossBatchDeduplicator() {
        this(new EventNameMatcher(), new NoOpMetricsService());
    }

    public CrossBatchDeduplicator(EventNameMatcher nameMatcher, MetricsService metrics) {
        this.nameMatcher = nameMatcher;
        this.metrics = metrics;
    }

    public DedupResult deduplicate(List<Event> events) {
        Map<Object, List<Event>> buckets = new LinkedHashMap<>();
        for (Event event : events) {
            Object key = bucketKey(event);
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
        }

        List<Event> unique = new ArrayList<>();
        int merged = 0;
        for (List<Event> bucket : buckets.values()) {
            if (bucket.size() == 1) {
                unique.add(bucket.get(0));
                continue;
            }
            List<Event> survivors = new ArrayList<>();
            for (Event event : bucket) {
                int index = findDuplicate(event, survivors);
                if (index < 0) {
                    survivors.add(event);
                } else {
                    survivors.set(index, mergePair(survivors.get(index), event));
                    merged++;
                }
            }
            unique.addAll(survivors);
        }

        metrics.incrementDuplicatesMerged(merged);
        log.info("dedup.completed input={} output={} merged={}", events.size(), unique.size(), merged);
        return new DedupResult(unique, merged);
    }

    private int findDuplicate(Event event, List<Event> survivors) {
        for (int i = 0; i < survivors.size(); i++) {
            if (nameMatcher.areSimilar(event.getName(), survivors.get(i).getName())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Merges {@code incoming} into {@code existing} and returns the event that survives.
     */
    Event mergePair(Event existing, Event incoming) {
        List<String> urls = new ArrayList<>(existing.getUrls());
        for (String url : incoming.getUrls()) {
            if (!url.isEmpty() && !urls.contains(url)) {
                urls.add(url);
            }
        }

        Event winner = prefersIncoming(existing, incoming) ? incoming : existing;
        winner.setUrls(urls);
        log.debug("Merged duplicate '{}' into '{}'",
                winner == incoming ? existing.getName() : incoming.getName(), winner.getName());
        return winner;
    }

    private static boolean prefersIncoming(Event existing, Event incoming) {
        int existingLength = length(existing.getName());
        int incomingLength = length(incoming.getName());
        if (incomingLength != existingLength) {
            return incomingLength < existingLength;
        }
        return length(incoming.getDescription()) > length(existing.getDescription());
    }

    private static int length(String s) {
        return s != null ? s.codePointCount(0, s.length()) : 0;
    }

    private static Object bucketKey(Event event) {
        if (!event.hasCoordinates() || event.getOccurrences().isEmpty() || event.getName() == null) {
            return new Object();
        }
        return new BucketKey(event.getLat(), event.getLng(), event.getOccurrences().get(0).startDate());
    }

    private record BucketKey(double lat, double lng, String startDate) {
    }
}
