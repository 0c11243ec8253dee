package com.event.resolution.export;

import java.util.Objects;

/**
 * Options for splitting and writing the published dataset.
 */
public final class ExportOptions {

    private final BoundingBox initBoundingBox;
    private final int initDays;
    private final int coordinateScale;
    private final boolean includeUnlocated;

    private ExportOptions(Builder builder) {
        this.initBoundingBox = builder.initBoundingBox;
        this.initDays = builder.initDays;
        this.coordinateScale = builder.coordinateScale;
        this.includeUnlocated = builder.includeUnlocated;
    }

    public static ExportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Area an event must lie in to be part of the init set. */
    public BoundingBox getInitBoundingBox() {
        return initBoundingBox;
    }

    /** The init set only holds events starting before today plus this many days. */
    public int getInitDays() {
        return initDays;
    }

    /** Decimal places coordinates are rounded to when matching events to registry entries. */
    public int getCoordinateScale() {
        return coordinateScale;
    }

    /** Whether events without coordinates are written to the full set. */
    public boolean isIncludeUnlocated() {
        return includeUnlocated;
    }

    @Override
    public String toString() {
        return "ExportOptions{initBoundingBox=" + initBoundingBox +
                ", initDays=" + initDays +
                ", coordinateScale=" + coordinateScale +
                ", includeUnlocated=" + includeUnlocated + '}';
    }

    public static class Builder {
        private BoundingBox initBoundingBox = BoundingBox.lowerManhattan();
        private int initDays = 7;
        private int coordinateScale = 5;
        private boolean includeUnlocated = false;

        public Builder initBoundingBox(BoundingBox initBoundingBox) {
            this.initBoundingBox = Objects.requireNonNull(initBoundingBox, "initBoundingBox is required");
            return this;
        }

        public Builder initDays(int initDays) {
            if (initDays < 0) {
                throw new IllegalArgumentException("initDays must be >= 0");
            }
            this.initDays = initDays;
            return this;
        }

        public Builder coordinateScale(int coordinateScale) {
            if (coordinateScale < 0 || coordinateScale > 15) {
                throw new IllegalArgumentException("coordinateScale must be between 0 and 15");
            }
            this.coordinateScale = coordinateScale;
            return this;
        }

        public Builder includeUnlocated(boolean includeUnlocated) {
            this.includeUnlocated = includeUnlocated;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(this);
        }
    }
}
