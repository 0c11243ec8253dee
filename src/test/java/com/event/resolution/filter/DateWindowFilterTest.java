package com.event.resolution.filter;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DateWindowFilterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private DateWindowFilter filter;

    @BeforeEach
    void setUp() {
        filter = new DateWindowFilter(CLOCK);
    }

    @Nested
    @DisplayName("Row checks")
    class RowTests {

        @ParameterizedTest
        @DisplayName("Should keep rows overlapping the window")
        @CsvSource({
                "2025-06-01, ''",
                "2025-06-10, ''",
                "2025-08-30, ''",
                "2025-05-01, 2025-06-01",
                "2025-5-20, 2025-6-5"
        })
        void testKept(String start, String end) {
            assertEquals(Optional.empty(), filter.checkRow(start, end));
        }

        @ParameterizedTest
        @DisplayName("Should drop rows outside the window")
        @CsvSource({
                "2025-08-31, ''",
                "2025-09-29, ''",
                "2025-05-01, ''",
                "2025-05-01, 2025-05-31"
        })
        void testOutOfWindow(String start, String end) {
            assertEquals(Optional.of(DropReason.OUT_OF_WINDOW), filter.checkRow(start, end));
        }

        @Test
        @DisplayName("Should drop rows spanning more than the maximum duration")
        void testTooLong() {
            assertEquals(Optional.of(DropReason.TOO_LONG), filter.checkRow("2025-05-01", "2026-06-15"));
            assertEquals(Optional.empty(), filter.checkRow("2025-05-01", "2026-06-05"));
        }

        @Test
        @DisplayName("Should drop rows with unparseable dates")
        void testUnparseable() {
            assertEquals(Optional.of(DropReason.UNPARSEABLE_DATE), filter.checkRow("TBD", ""));
            assertEquals(Optional.of(DropReason.UNPARSEABLE_DATE), filter.checkRow("", ""));
            assertEquals(Optional.of(DropReason.UNPARSEABLE_DATE), filter.checkRow(null, null));
            assertEquals(Optional.of(DropReason.UNPARSEABLE_DATE), filter.checkRow("2025-06-10", "soon"));
        }

        @Test
        @DisplayName("Should honor a custom window")
        void testCustomWindow() {
            DateWindowFilter week = new DateWindowFilter(CLOCK, 7, 30);

            assertEquals(Optional.of(DropReason.OUT_OF_WINDOW), week.checkRow("2025-06-09", ""));
            assertEquals(Optional.of(DropReason.TOO_LONG), week.checkRow("2025-06-01", "2025-07-15"));
            assertThrows(IllegalArgumentException.class, () -> new DateWindowFilter(CLOCK, -1, 30));
        }
    }

    @Nested
    @DisplayName("Event checks")
    class EventTests {

        @Test
        @DisplayName("Should keep events with at least one occurrence in the window")
        void testAnyOccurrenceOverlaps() {
            Event event = Event.builder()
                    .name("Jazz Night")
                    .occurrence("2025-04-01", "", "", "")
                    .occurrence("2025-06-15", "7pm", "", "")
                    .build();

            assertTrue(filter.overlapsWindow(event));
        }

        @Test
        @DisplayName("Should drop events whose occurrences are all outside the window")
        void testNoOccurrenceOverlaps() {
            Event event = Event.builder()
                    .name("Jazz Night")
                    .occurrence("2025-04-01", "", "", "")
                    .occurrence("2025-12-01", "", "", "")
                    .build();

            assertFalse(filter.overlapsWindow(event));
        }

        @Test
        @DisplayName("Should ignore occurrences with missing or malformed dates")
        void testMalformedOccurrences() {
            Event event = Event.builder()
                    .name("Jazz Night")
                    .occurrence("", "", "", "")
                    .occurrence("not a date", "", "", "")
                    .build();

            assertFalse(filter.overlapsWindow(event));
        }

        @Test
        @DisplayName("Should keep a running exhibition that started in the past")
        void testOngoingExhibition() {
            Event event = Event.builder()
                    .name("Modern Masters")
                    .occurrence("2025-03-01", "", "2025-09-01", "")
                    .build();

            assertTrue(filter.overlapsWindow(event));
            assertEquals(LocalDate.of(2025, 6, 1), filter.today());
        }
    }
}
