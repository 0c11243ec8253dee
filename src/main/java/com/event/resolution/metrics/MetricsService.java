package com.event.resolution.metrics;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.MatchKind;

import java.time.Duration;

/**
 * Interface for recording event resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRowDropped(DropReason reason);

    void recordLocationResolved(MatchKind kind);

    void recordLocationUnresolved();

    void recordMatchScore(double score);

    void recordEventsProduced(int count);

    void recordFileDuration(Duration duration);

    void incrementDuplicatesMerged(int count);

    void recordCacheHit();

    void recordCacheMiss();
}
