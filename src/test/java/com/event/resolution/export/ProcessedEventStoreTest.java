package com.event.resolution.export;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.Occurrence;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessedEventStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private ProcessedEventStore store;

    @BeforeEach
    void setUp() {
        store = new ProcessedEventStore(CLOCK);
    }

    @Test
    @DisplayName("Should derive the output path from the source file name")
    void testOutputPath() {
        assertEquals(tempDir.resolve("20250913").resolve("the_oculus.json"),
                store.outputPath(tempDir, "20250913_the_oculus.md"));
        assertEquals(tempDir.resolve("20250601").resolve("notes.json"),
                store.outputPath(tempDir, "notes.md"));
        assertEquals(tempDir.resolve("20250601").resolve("README.json"),
                store.outputPath(tempDir, "README"));
    }

    @Test
    @DisplayName("Should write events in the published JSON shape")
    void testWriteShape() throws IOException {
        Event event = Event.builder()
                .name("Café Concert")
                .shortName("Café Concert")
                .location("Film Forum")
                .description("Strings")
                .url("https://a.example")
                .tags(List.of("Music"))
                .coordinates(40.7284, -74.0044)
                .occurrence("2025-06-03", "7pm", "", "9pm")
                .build();

        Path file = store.write(tempDir, "20250601_film_forum.md", List.of(event));

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("Café Concert"), "Non-ASCII text should not be escaped");
        JsonNode node = new ObjectMapper().readTree(json).get(0);
        assertEquals("Café Concert", node.get("short_name").asText());
        assertTrue(node.get("occurrences").get(0).isArray());
        assertEquals("9pm", node.get("occurrences").get(0).get(3).asText());
        assertEquals("https://a.example", node.get("urls").get(0).asText());
        assertFalse(node.has("sublocation"));
        assertFalse(node.has("emoji"));
    }

    @Test
    @DisplayName("Should read back what it wrote")
    void testReadWritten() throws IOException {
        Event event = Event.builder()
                .name("Jaws")
                .occurrence("2025-06-03", "7pm", "", "")
                .occurrence("2025-06-04", "", "2025-06-05", "")
                .build();
        Path file = store.write(tempDir, "20250601_film_forum.md", List.of(event));

        List<Event> read = store.read(file);

        assertEquals(1, read.size());
        assertEquals(List.of(new Occurrence("2025-06-03", "7pm", "", ""),
                new Occurrence("2025-06-04", "", "2025-06-05", "")), read.get(0).getOccurrences());
    }

    @Test
    @DisplayName("Should read a legacy single url field")
    void testLegacyUrl() throws IOException {
        Path file = tempDir.resolve("legacy.json");
        Files.writeString(file, """
                [{"name": "Jaws", "url": " https://old.example ", "occurrences": [["2025-06-03", "", "", ""]],
                  "unknown_field": 1}]
                """, StandardCharsets.UTF_8);

        Event event = store.read(file).get(0);

        assertEquals(List.of("https://old.example"), event.getUrls());
    }

    @Test
    @DisplayName("Should list json files one level below the processed directory")
    void testListProcessedFiles() throws IOException {
        Files.createDirectories(tempDir.resolve("20250602"));
        Files.createDirectories(tempDir.resolve("20250601"));
        Files.writeString(tempDir.resolve("20250602/b.json"), "[]");
        Files.writeString(tempDir.resolve("20250601/z.json"), "[]");
        Files.writeString(tempDir.resolve("20250601/a.json"), "[]");
        Files.writeString(tempDir.resolve("20250601/notes.txt"), "");
        Files.writeString(tempDir.resolve("top.json"), "[]");

        List<Path> files = store.listProcessedFiles(tempDir);

        assertEquals(List.of(
                tempDir.resolve("20250601/a.json"),
                tempDir.resolve("20250601/z.json"),
                tempDir.resolve("20250602/b.json")), files);
        assertTrue(store.listProcessedFiles(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    @DisplayName("Should fail to read a corrupt file")
    void testCorruptFile() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{oops");

        assertThrows(IOException.class, () -> store.read(file));
    }

    @Test
    @DisplayName("Should strip only the last extension")
    void testStripExtension() {
        assertEquals("site.v2", ProcessedEventStore.stripExtension("site.v2.md"));
        assertEquals(".hidden", ProcessedEventStore.stripExtension(".hidden"));
    }
}
