package com.event.resolution.filter;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.Occurrence;
import com.event.resolution.text.IsoDates;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps rows and events whose dates overlap the look-ahead window {@code [today, today + N days]}.
 *
 * <p>A window overlap means {@code start <= today + N} and {@code effectiveEnd >= today}, where
 * the effective end falls back to the start date. Rows additionally must parse and must not
 * span more than the maximum duration.</p>
 */
public class DateWindowFilter {

    public static final int DEFAULT_WINDOW_DAYS = 90;
    public static final int DEFAULT_MAX_DURATION_DAYS = 400;

    private final Clock clock;
    private final int windowDays;
    private final int maxDurationDays;

    public DateWindowFilter(Clock clock) {
        this(clock, DEFAULT_WINDOW_DAYS, DEFAULT_MAX_DURATION_DAYS);
    }

    public DateWindowFilter(Clock clock, int windowDays, int maxDurationDays) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must be >= 0");
        }
        if (maxDurationDays < 0) {
            throw new IllegalArgumentException("maxDurationDays must be >= 0");
        }
        this.windowDays = windowDays;
        this.maxDurationDays = maxDurationDays;
    }

    /**
     * Checks one table row by its start and end date.
     *
     * @return the reason to drop the row, or empty to keep it
     */
    public Optional<DropReason> checkRow(String startDate, String endDate) {
        Optional<LocalDate> start = IsoDates.parse(startDate == null ? "" : startDate.strip());
        if (start.isEmpty()) {
            return Optional.of(DropReason.UNPARSEABLE_DATE);
        }
        LocalDate today = today();
        if (start.get().isAfter(today.plusDays(windowDays))) {
            return Optional.of(DropReason.OUT_OF_WINDOW);
        }
        String endText = endDate == null || endDate.isBlank() ? startDate.strip() : endDate.strip();
        Optional<LocalDate> end = IsoDates.parse(endText);
        if (end.isEmpty()) {
            return Optional.of(DropReason.UNPARSEABLE_DATE);
        }
        if (end.get().isBefore(today)) {
            return Optional.of(DropReason.OUT_OF_WINDOW);
        }
        if (ChronoUnit.DAYS.between(start.get(), end.get()) > maxDurationDays) {
            return Optional.of(DropReason.TOO_LONG);
        }
        return Optional.empty();
    }

    /**
     * True if at least one occurrence overlaps the window. Occurrences with a missing or
     * malformed date are ignored.
     */
    public boolean overlapsWindow(Event event) {
        LocalDate today = today();
        LocalDate limit = today.plusDays(windowDays);
        for (Occurrence occurrence : event.getOccurrences()) {
            if (!occurrence.hasStartDate()) {
                continue;
            }
            Optional<LocalDate> start = IsoDates.parse(occurrence.startDate());
            Optional<LocalDate> end = IsoDates.parse(occurrence.effectiveEndDate());
            if (start.isPresent() && end.isPresent()
                    && !start.get().isAfter(limit) && !end.get().isBefore(today)) {
                return true;
            }
        }
        return false;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
