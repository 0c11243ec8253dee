package com.event.resolution.export;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.LocationEntry;
import com.event.resolution.filter.DateWindowFilter;
import com.event.resolution.filter.TagFilter;
import com.event.resolution.logging.LogContext;
import com.event.resolution.merge.CrossBatchDeduplicator;
import com.event.resolution.merge.DedupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the published dataset from every processed file.
 *
 * <p>Steps: load all events, cross-batch dedup, window and remove-tag filter, drop unlocated
 * events (unless configured otherwise), sort by first start date, then split into init and
 * full sets and write {@code events.init.json}, {@code locations.init.json},
 * {@code events.full.json} and {@code locations.full.json}.</p>
 */
public class ExportService {
    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    public static final String EVENTS_INIT = "events.init.json";
    public static final String LOCATIONS_INIT = "locations.init.json";
    public static final String EVENTS_FULL = "events.full.json";
    public static final String LOCATIONS_FULL = "locations.full.json";

    private final ProcessedEventStore store;
    private final CrossBatchDeduplicator deduplicator;
    private final DateWindowFilter dateFilter;
    private final TagFilter tagFilter;
    private final EventPartitioner partitioner;
    private final ExportOptions options;

    public ExportService(ProcessedEventStore store, CrossBatchDeduplicator deduplicator,
                         DateWindowFilter dateFilter, TagFilter tagFilter,
                         EventPartitioner partitioner, ExportOptions options) {
        this.store = store;
        this.deduplicator = deduplicator;
        this.dateFilter = dateFilter;
        this.tagFilter = tagFilter;
        this.partitioner = partitioner;
        this.options = options;
    }

    /**
     * Runs a full export from {@code processedDir} into {@code outputDir}.
     *
     * @throws UncheckedIOException if the processed directory cannot be listed or an output
     *                              file cannot be written
     */
    public ExportResult export(Path processedDir, Path outputDir, List<LocationEntry> registry) {
        try (LogContext ctx = LogContext.forExport(LogContext.generateBatchId())) {
            List<String> unreadable = new ArrayList<>();
            List<Event> events = loadAll(processedDir, unreadable);
            PreparedExport prepared = prepare(events, registry);
            Partition partition = prepared.partition();

            store.writeJson(outputDir.resolve(EVENTS_INIT), partition.initEvents());
            store.writeJson(outputDir.resolve(LOCATIONS_INIT), partition.initLocations());
            store.writeJson(outputDir.resolve(EVENTS_FULL), partition.fullEvents());
            store.writeJson(outputDir.resolve(LOCATIONS_FULL), partition.fullLocations());

            ExportResult result = new ExportResult(events.size(), unreadable,
                    prepared.duplicatesMerged(), prepared.filteredOut(), prepared.unlocatedDropped(),
                    partition.initEvents().size(), partition.initLocations().size(),
                    partition.fullEvents().size(), partition.fullLocations().size());
            log.info("export.completed init={} full={} result={}",
                    partition.initEvents().size(), partition.fullEvents().size(), result);
            return result;
        }
    }

    /**
     * Everything but the file I/O: dedup, filter, sort and partition.
     */
    public PreparedExport prepare(List<Event> events, List<LocationEntry> registry) {
        DedupResult deduped = deduplicator.deduplicate(events);

        List<Event> kept = new ArrayList<>();
        int filtered = 0;
        int unlocated = 0;
        for (Event event : deduped.events()) {
            if (!dateFilter.overlapsWindow(event) || !tagFilter.accepts(event)) {
                filtered++;
                continue;
            }
            if (!event.hasCoordinates() && !options.isIncludeUnlocated()) {
                unlocated++;
                continue;
            }
            kept.add(event);
        }
        log.debug("Export keeps {} of {} events ({} filtered, {} unlocated)",
                kept.size(), deduped.events().size(), filtered, unlocated);

        Partition partition = partitioner.partition(EventPartitioner.sortByFirstStartDate(kept), registry);
        return new PreparedExport(partition, deduped.mergedCount(), filtered, unlocated);
    }

    private List<Event> loadAll(Path processedDir, List<String> unreadable) {
        List<Path> files;
        try {
            files = store.listProcessedFiles(processedDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + processedDir, e);
        }
        List<Event> events = new ArrayList<>();
        for (Path file : files) {
            try {
                events.addAll(store.read(file));
            } catch (IOException e) {
                unreadable.add(file.toString());
                log.warn("export.file.unreadable file={} error={}", file, e.getMessage());
            }
        }
        log.info("export.loaded files={} events={}", files.size(), events.size());
        return events;
    }

    /**
     * Result of {@link #prepare}: the partition plus the counts that led to it.
     */
    public record PreparedExport(Partition partition, int duplicatesMerged, int filteredOut, int unlocatedDropped) {
    }
}
