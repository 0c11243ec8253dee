package com.event.resolution.api;

import com.event.resolution.bulk.BatchResult;
import com.event.resolution.bulk.DirectoryProcessor;
import com.event.resolution.bulk.ProgressCallback;
import com.event.resolution.cache.CacheConfig;
import com.event.resolution.cache.CacheStats;
import com.event.resolution.cache.ResolutionCache;
import com.event.resolution.core.model.LocationEntry;
import com.event.resolution.core.model.TagRules;
import com.event.resolution.export.EventPartitioner;
import com.event.resolution.export.ExportOptions;
import com.event.resolution.export.ExportResult;
import com.event.resolution.export.ExportService;
import com.event.resolution.export.ProcessedEventStore;
import com.event.resolution.filter.DateWindowFilter;
import com.event.resolution.filter.TagFilter;
import com.event.resolution.grouping.OccurrenceGrouper;
import com.event.resolution.location.LocationIndex;
import com.event.resolution.location.LocationRegistryLoader;
import com.event.resolution.location.LocationResolver;
import com.event.resolution.merge.CrossBatchDeduplicator;
import com.event.resolution.metrics.MetricsService;
import com.event.resolution.metrics.NoOpMetricsService;
import com.event.resolution.parse.TableParser;
import com.event.resolution.rules.TagRulesLoader;
import com.event.resolution.text.EventNameMatcher;
import com.event.resolution.text.NameNormalizer;
import com.event.resolution.text.TagNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point for the event resolution library.
 * Provides a fluent API for configuring and running the pipeline.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * EventResolver resolver = EventResolver.builder()
 *     .locationsFile(Path.of("data/locations.json"))
 *     .tagRulesFile(Path.of("data/tags.json"))
 *     .build();
 *
 * // One extracted table
 * FileProcessingResult result = resolver.processTable(tableText, "20250913_oculus.md");
 *
 * // Everything not yet processed, then the published dataset
 * resolver.processDirectory(Path.of("event_data/extracted"), Path.of("event_data/processed"), null);
 * resolver.export(Path.of("event_data/processed"), Path.of("public_html/data"));
 * </pre>
 *
 * <p>The location registry and tag rules are loaded once and shared read-only by every call.</p>
 */
public class EventResolver {
    private static final Logger log = LoggerFactory.getLogger(EventResolver.class);

    private final LocationIndex locationIndex;
    private final ResolutionCache cache;
    private final EventProcessingService processingService;
    private final DirectoryProcessor directoryProcessor;
    private final ExportService exportService;

    private EventResolver(Builder builder) {
        ProcessingOptions options = builder.options;
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TagRules tagRules = builder.tagRules != null ? builder.tagRules : TagRules.empty();
        this.cache = builder.resolutionCache != null
                ? builder.resolutionCache : builder.cacheConfig.createCache();

        this.locationIndex = LocationIndex.build(builder.locations, options.getMinKeyLength());
        LocationResolver locationResolver = LocationResolver.builder(locationIndex)
                .threshold(options.getMatchThreshold())
                .minQueryLength(options.getMinKeyLength())
                .cache(cache)
                .metrics(metrics)
                .build();

        EventNameMatcher nameMatcher = new EventNameMatcher(options.getMinFuzzyNameLength());
        DateWindowFilter dateFilter = new DateWindowFilter(options.getClock(),
                options.getWindowDays(), options.getMaxDurationDays());
        ProcessedEventStore store = new ProcessedEventStore(options.getClock());

        this.processingService = new EventProcessingService(new TableParser(), new TagNormalizer(),
                new NameNormalizer(), locationResolver, new OccurrenceGrouper(nameMatcher, metrics),
                dateFilter, tagRules, metrics);
        this.directoryProcessor = new DirectoryProcessor(processingService, store);
        this.exportService = new ExportService(store, new CrossBatchDeduplicator(nameMatcher, metrics),
                dateFilter, new TagFilter(tagRules),
                new EventPartitioner(builder.exportOptions, options.getClock()), builder.exportOptions);

        log.info("EventResolver initialized: locations={} keys={} options={}",
                builder.locations.size(), locationIndex.size(), options);
    }

    /**
     * Turns one extracted table into finalized events without writing anything.
     */
    public FileProcessingResult processTable(String text, String sourceFileName) {
        return processingService.processTable(text, sourceFileName);
    }

    /**
     * Processes every extracted file that has no output yet and writes one JSON file per source.
     */
    public BatchResult processDirectory(Path extractedDir, Path processedDir, ProgressCallback callback) {
        return directoryProcessor.process(extractedDir, processedDir, callback);
    }

    /**
     * Builds and writes the init/full event and location files from all processed files.
     */
    public ExportResult export(Path processedDir, Path outputDir) {
        return exportService.export(processedDir, outputDir, locationIndex.entries());
    }

    public LocationIndex getLocationIndex() {
        return locationIndex;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<LocationEntry> locations;
        private TagRules tagRules;
        private ProcessingOptions options = ProcessingOptions.defaults();
        private ExportOptions exportOptions = ExportOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private ResolutionCache resolutionCache;
        private MetricsService metricsService;

        public Builder locations(List<LocationEntry> locations) {
            this.locations = List.copyOf(locations);
            return this;
        }

        /**
         * Loads the location registry immediately.
         *
         * @throws com.event.resolution.location.RegistryLoadException if it cannot be read
         */
        public Builder locationsFile(Path path) {
            this.locations = LocationRegistryLoader.load(path);
            return this;
        }

        public Builder tagRules(TagRules tagRules) {
            this.tagRules = tagRules;
            return this;
        }

        /**
         * Loads tag rules; a missing or corrupt file falls back to empty rules.
         */
        public Builder tagRulesFile(Path path) {
            this.tagRules = TagRulesLoader.load(path);
            return this;
        }

        public Builder options(ProcessingOptions options) {
            this.options = options;
            return this;
        }

        public Builder exportOptions(ExportOptions exportOptions) {
            this.exportOptions = exportOptions;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder resolutionCache(ResolutionCache resolutionCache) {
            this.resolutionCache = resolutionCache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public EventResolver build() {
            if (locations == null) {
                throw new IllegalStateException("A location registry is required");
            }
            if (options == null || exportOptions == null || cacheConfig == null) {
                throw new IllegalStateException("Options must not be null");
            }
            return new EventResolver(this);
        }
    }
}
