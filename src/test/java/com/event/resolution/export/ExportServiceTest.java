package com.event.resolution.export;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.LocationEntry;
import com.event.resolution.core.model.TagRules;
import com.event.resolution.filter.DateWindowFilter;
import com.event.resolution.filter.TagFilter;
import com.event.resolution.merge.CrossBatchDeduplicator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExportServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private static final LocationEntry FILM_FORUM = LocationEntry.of("Film Forum", 40.7284, -74.0044);
    private static final LocationEntry BROOKLYN_MUSEUM = LocationEntry.of("Brooklyn Museum", 40.6712, -73.9636);
    private static final List<LocationEntry> REGISTRY = List.of(FILM_FORUM, BROOKLYN_MUSEUM);

    @TempDir
    Path tempDir;

    private ProcessedEventStore store;
    private Path processedDir;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        store = new ProcessedEventStore(CLOCK);
        processedDir = tempDir.resolve("processed");
        outputDir = tempDir.resolve("public");
    }

    private ExportService service(ExportOptions options) {
        TagRules rules = new TagRules(Map.of(), Set.of(), Set.of("Private Event"));
        return new ExportService(store, new CrossBatchDeduplicator(), new DateWindowFilter(CLOCK),
                new TagFilter(rules), new EventPartitioner(options, CLOCK), options);
    }

    private static Event event(String name, LocationEntry at, String date, String url, String... tags) {
        Event.Builder builder = Event.builder()
                .name(name)
                .url(url)
                .tags(List.of(tags))
                .occurrence(date, "7pm", "", "");
        if (at != null) {
            builder.coordinates(at.getLat(), at.getLng());
        }
        return builder.build();
    }

    @Test
    @DisplayName("Should dedup, filter, split and write the four output files")
    void testExport() throws IOException {
        store.write(processedDir, "20250530_film_forum.md", List.of(
                event("Jazz Night", FILM_FORUM, "2025-06-03", "https://a.example"),
                event("Old Show", FILM_FORUM, "2025-04-01", "https://old.example")));
        store.write(processedDir, "20250531_listings.md", List.of(
                event("_Jazz Night_", FILM_FORUM, "2025-06-03", "https://b.example"),
                event("Gala", BROOKLYN_MUSEUM, "2025-06-20", "https://c.example"),
                event("Members Preview", BROOKLYN_MUSEUM, "2025-06-05", "", "Private Event"),
                event("Somewhere", null, "2025-06-04", "")));

        ExportResult result = service(ExportOptions.defaults()).export(processedDir, outputDir, REGISTRY);

        assertEquals(6, result.eventsLoaded());
        assertEquals(1, result.duplicatesMerged());
        assertEquals(2, result.filteredOut());
        assertEquals(1, result.unlocatedDropped());
        assertEquals(1, result.initEvents());
        assertEquals(1, result.fullEvents());
        assertTrue(result.unreadableFiles().isEmpty());

        ObjectMapper mapper = new ObjectMapper();
        JsonNode init = mapper.readTree(outputDir.resolve(ExportService.EVENTS_INIT).toFile());
        assertEquals("Jazz Night", init.get(0).get("name").asText());
        assertEquals(2, init.get(0).get("urls").size());
        JsonNode initLocations = mapper.readTree(outputDir.resolve(ExportService.LOCATIONS_INIT).toFile());
        assertEquals("Film Forum", initLocations.get(0).get("name").asText());
        JsonNode full = mapper.readTree(outputDir.resolve(ExportService.EVENTS_FULL).toFile());
        assertEquals("Gala", full.get(0).get("name").asText());
        JsonNode fullLocations = mapper.readTree(outputDir.resolve(ExportService.LOCATIONS_FULL).toFile());
        assertEquals(1, fullLocations.size());
        assertEquals("Brooklyn Museum", fullLocations.get(0).get("name").asText());
    }

    @Test
    @DisplayName("Should keep unlocated events in the full set when configured")
    void testIncludeUnlocated() {
        ExportOptions options = ExportOptions.builder().includeUnlocated(true).build();

        ExportService.PreparedExport prepared = service(options).prepare(
                List.of(event("Somewhere", null, "2025-06-04", "")), REGISTRY);

        assertEquals(0, prepared.unlocatedDropped());
        assertEquals(1, prepared.partition().fullEvents().size());
        assertTrue(prepared.partition().fullLocations().isEmpty());
    }

    @Test
    @DisplayName("Should skip unreadable processed files and continue")
    void testUnreadableFile() throws IOException {
        store.write(processedDir, "20250530_film_forum.md", List.of(
                event("Jazz Night", FILM_FORUM, "2025-06-03", "https://a.example")));
        Files.writeString(processedDir.resolve("20250530").resolve("broken.json"), "[{\"name\": ");

        ExportResult result = service(ExportOptions.defaults()).export(processedDir, outputDir, REGISTRY);

        assertEquals(1, result.unreadableFiles().size());
        assertEquals(1, result.initEvents());
    }

    @Test
    @DisplayName("Should write empty outputs when nothing was processed")
    void testEmptyExport() throws IOException {
        ExportResult result = service(ExportOptions.defaults()).export(processedDir, outputDir, REGISTRY);

        assertEquals(0, result.eventsLoaded());
        assertEquals("[ ]", Files.readString(outputDir.resolve(ExportService.EVENTS_FULL)).strip());
    }
}
