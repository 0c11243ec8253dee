package com.event.resolution.metrics;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.MatchKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code event.row.dropped} - Counter (tag: reason)</li>
 *   <li>{@code event.location.resolved} - Counter (tag: kind)</li>
 *   <li>{@code event.location.unresolved} - Counter</li>
 *   <li>{@code event.location.score} - DistributionSummary</li>
 *   <li>{@code event.file.events} - DistributionSummary</li>
 *   <li>{@code event.file.duration} - Timer</li>
 *   <li>{@code event.duplicates.merged} - Counter</li>
 *   <li>{@code event.cache.hit} / {@code event.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter unresolvedCounter;
    private final DistributionSummary matchScoreSummary;
    private final DistributionSummary eventsPerFileSummary;
    private final Timer fileTimer;
    private final Counter duplicatesCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.unresolvedCounter = Counter.builder("event.location.unresolved")
                .description("Number of rows whose venue matched no registry entry")
                .register(registry);
        this.matchScoreSummary = DistributionSummary.builder("event.location.score")
                .description("Distribution of winning location match scores")
                .register(registry);
        this.eventsPerFileSummary = DistributionSummary.builder("event.file.events")
                .description("Events produced per source file")
                .register(registry);
        this.fileTimer = Timer.builder("event.file.duration")
                .description("Duration of per-file processing")
                .register(registry);
        this.duplicatesCounter = Counter.builder("event.duplicates.merged")
                .description("Number of events merged away by cross-batch dedup")
                .register(registry);
        this.cacheHitCounter = Counter.builder("event.cache.hit")
                .description("Number of location cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("event.cache.miss")
                .description("Number of location cache misses")
                .register(registry);
    }

    @Override
    public void recordRowDropped(DropReason reason) {
        counter("event.row.dropped", "reason", reason.name(), "Number of dropped rows").increment();
    }

    @Override
    public void recordLocationResolved(MatchKind kind) {
        counter("event.location.resolved", "kind", kind.name(), "Number of resolved locations").increment();
    }

    @Override
    public void recordLocationUnresolved() {
        unresolvedCounter.increment();
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void recordEventsProduced(int count) {
        eventsPerFileSummary.record(count);
    }

    @Override
    public void recordFileDuration(Duration duration) {
        fileTimer.record(duration);
    }

    @Override
    public void incrementDuplicatesMerged(int count) {
        duplicatesCounter.increment(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
