package com.event.resolution.metrics;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.MatchKind;

import java.time.Duration;

/**
 * No-op metrics implementation. All operations are no-ops.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRowDropped(DropReason reason) {
    }

    @Override
    public void recordLocationResolved(MatchKind kind) {
    }

    @Override
    public void recordLocationUnresolved() {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordEventsProduced(int count) {
    }

    @Override
    public void recordFileDuration(Duration duration) {
    }

    @Override
    public void incrementDuplicatesMerged(int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
