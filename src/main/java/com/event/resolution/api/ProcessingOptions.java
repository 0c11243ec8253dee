package com.event.resolution.api;

import java.time.Clock;
import java.util.Objects;

/**
 * Options for turning extracted tables into events.
 * Configures the date window, location matching and fuzzy name matching.
 */
public class ProcessingOptions {

    private static final int DEFAULT_WINDOW_DAYS = 90;
    private static final int DEFAULT_MAX_DURATION_DAYS = 400;
    private static final double DEFAULT_MATCH_THRESHOLD = 0.85;
    private static final int DEFAULT_MIN_KEY_LENGTH = 5;
    private static final int DEFAULT_MIN_FUZZY_NAME_LENGTH = 5;

    private final Clock clock;
    private final int windowDays;
    private final int maxDurationDays;
    private final double matchThreshold;
    private final int minKeyLength;
    private final int minFuzzyNameLength;

    private ProcessingOptions(Builder builder) {
        this.clock = builder.clock;
        this.windowDays = builder.windowDays;
        this.maxDurationDays = builder.maxDurationDays;
        this.matchThreshold = builder.matchThreshold;
        this.minKeyLength = builder.minKeyLength;
        this.minFuzzyNameLength = builder.minFuzzyNameLength;
    }

    /**
     * Clock that defines "today" for every date comparison.
     */
    public Clock getClock() {
        return clock;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public int getMaxDurationDays() {
        return maxDurationDays;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    /**
     * Index keys must be at least this long; query strings must be longer.
     */
    public int getMinKeyLength() {
        return minKeyLength;
    }

    public int getMinFuzzyNameLength() {
        return minFuzzyNameLength;
    }

    public static ProcessingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ProcessingOptions{" +
                "windowDays=" + windowDays +
                ", maxDurationDays=" + maxDurationDays +
                ", matchThreshold=" + matchThreshold +
                ", minKeyLength=" + minKeyLength +
                ", minFuzzyNameLength=" + minFuzzyNameLength +
                '}';
    }

    public static class Builder {
        private Clock clock = Clock.systemDefaultZone();
        private int windowDays = DEFAULT_WINDOW_DAYS;
        private int maxDurationDays = DEFAULT_MAX_DURATION_DAYS;
        private double matchThreshold = DEFAULT_MATCH_THRESHOLD;
        private int minKeyLength = DEFAULT_MIN_KEY_LENGTH;
        private int minFuzzyNameLength = DEFAULT_MIN_FUZZY_NAME_LENGTH;

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public Builder windowDays(int windowDays) {
            if (windowDays < 0) {
                throw new IllegalArgumentException("windowDays must be >= 0");
            }
            this.windowDays = windowDays;
            return this;
        }

        public Builder maxDurationDays(int maxDurationDays) {
            if (maxDurationDays < 0) {
                throw new IllegalArgumentException("maxDurationDays must be >= 0");
            }
            this.maxDurationDays = maxDurationDays;
            return this;
        }

        public Builder matchThreshold(double matchThreshold) {
            if (matchThreshold < 0.0 || matchThreshold > 1.0) {
                throw new IllegalArgumentException("matchThreshold must be between 0.0 and 1.0");
            }
            this.matchThreshold = matchThreshold;
            return this;
        }

        public Builder minKeyLength(int minKeyLength) {
            if (minKeyLength < 1) {
                throw new IllegalArgumentException("minKeyLength must be >= 1");
            }
            this.minKeyLength = minKeyLength;
            return this;
        }

        public Builder minFuzzyNameLength(int minFuzzyNameLength) {
            if (minFuzzyNameLength < 0) {
                throw new IllegalArgumentException("minFuzzyNameLength must be >= 0");
            }
            this.minFuzzyNameLength = minFuzzyNameLength;
            return this;
        }

        public ProcessingOptions build() {
            return new ProcessingOptions(this);
        }
    }
}
