package com.event.resolution.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

    @Nested
    @DisplayName("Event")
    class EventTests {

        @Test
        @DisplayName("Should require at least one occurrence")
        void testRequiresOccurrence() {
            assertThrows(IllegalArgumentException.class, () -> Event.builder().name("Jaws").build());
        }

        @Test
        @DisplayName("Should keep coordinates paired")
        void testCoordinatesPaired() {
            Event event = Event.builder().name("Jaws").occurrence("2025-06-03", "", "", "").build();

            assertFalse(event.hasCoordinates());
            assertThrows(IllegalArgumentException.class, () -> event.setCoordinates(40.7, null));

            event.setCoordinates(40.7, -74.0);
            assertTrue(event.hasCoordinates());
            event.setCoordinates(null, null);
            assertFalse(event.hasCoordinates());
        }

        @Test
        @DisplayName("Should drop blank and duplicate URLs, tags and occurrences")
        void testNoDuplicates() {
            Event event = Event.builder()
                    .name("Jaws")
                    .url("https://a.example")
                    .url("")
                    .url("https://a.example")
                    .tags(List.of("Film", "Film", ""))
                    .occurrence("2025-06-03", "7pm", "", "")
                    .occurrence("2025-06-03", "7pm", "", "")
                    .build();

            assertEquals(List.of("https://a.example"), event.getUrls());
            assertEquals(List.of("Film"), event.getTags());
            assertEquals(1, event.getOccurrences().size());
            assertFalse(event.addUrl("https://a.example"));
            assertTrue(event.addUrl("https://b.example"));
        }

        @Test
        @DisplayName("Should report the first occurrence start date")
        void testFirstStartDate() {
            Event dated = Event.builder().name("Jaws")
                    .occurrence("2025-06-10", "", "", "")
                    .occurrence("2025-06-03", "", "", "")
                    .build();
            Event undated = Event.builder().name("Jaws").occurrence("", "", "", "").build();

            assertEquals("2025-06-10", dated.firstStartDate().orElseThrow());
            assertTrue(undated.firstStartDate().isEmpty());
        }

        @Test
        @DisplayName("Should treat an empty emoji as none")
        void testEmptyEmoji() {
            Event event = Event.builder().name("Jaws").emoji("").occurrence("2025-06-03", "", "", "").build();
            assertNull(event.getEmoji());
        }
    }

    @Nested
    @DisplayName("Occurrence")
    class OccurrenceTests {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("Should serialize as a four-element array")
        void testSerializeAsArray() throws Exception {
            String json = mapper.writeValueAsString(new Occurrence("2025-06-03", "7pm", null, "9pm"));
            assertEquals("[\"2025-06-03\",\"7pm\",\"\",\"9pm\"]", json);
        }

        @Test
        @DisplayName("Should pad short arrays with empty strings")
        void testDeserializeShortArray() throws Exception {
            Occurrence occurrence = mapper.readValue("[\"2025-06-03\",\"7pm\"]", Occurrence.class);
            assertEquals(new Occurrence("2025-06-03", "7pm", "", ""), occurrence);
        }

        @Test
        @DisplayName("Should fall back to the start date as effective end")
        void testEffectiveEndDate() {
            assertEquals("2025-06-03", new Occurrence("2025-06-03", "", "", "").effectiveEndDate());
            assertEquals("2025-06-05", new Occurrence("2025-06-03", "", "2025-06-05", "").effectiveEndDate());
        }
    }

    @Nested
    @DisplayName("TagRules and RawRow")
    class RulesAndRows {

        @ParameterizedTest
        @CsvSource({
                "Live Music, livemusic",
                "NYC, nyc",
                "'  Private  Event ', privateevent"
        })
        @DisplayName("Should compare tags ignoring case and spaces")
        void testLookupKey(String tag, String expected) {
            assertEquals(expected, TagRules.lookupKey(tag.strip()));
        }

        @Test
        @DisplayName("Should store rules in lookup form")
        void testRulesNormalized() {
            TagRules rules = new TagRules(Map.of("Live Music", "Music"),
                    Set.of("Free"), Set.of("Private Event"));

            assertEquals("Music", rules.rewrite().get("livemusic"));
            assertTrue(rules.isExcluded("FREE"));
            assertTrue(rules.isRemoving("privateevent"));
            assertFalse(rules.isRemoving("Private"));
        }

        @Test
        @DisplayName("Should fill missing trailing cells with empty strings")
        void testFromCells() {
            RawRow row = RawRow.fromCells(List.of("Jaws", "Film Forum", "", "2025-06-03"));

            assertEquals("Jaws", row.name());
            assertEquals("2025-06-03", row.startDate());
            assertEquals("", row.emoji());
            assertEquals("", row.hashtags());
        }
    }
}
