package com.event.resolution.bulk;

import com.event.resolution.api.EventProcessingService;
import com.event.resolution.api.FileProcessingResult;
import com.event.resolution.core.model.Event;
import com.event.resolution.export.ProcessedEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DirectoryProcessorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private EventProcessingService processingService;

    @TempDir
    Path tempDir;

    private ProcessedEventStore store;
    private DirectoryProcessor processor;
    private Path extractedDir;
    private Path processedDir;

    @BeforeEach
    void setUp() {
        store = new ProcessedEventStore(CLOCK);
        processor = new DirectoryProcessor(processingService, store);
        extractedDir = tempDir.resolve("extracted");
        processedDir = tempDir.resolve("processed");
    }

    private void extracted(String dateDir, String fileName, String content) throws IOException {
        Path dir = Files.createDirectories(extractedDir.resolve(dateDir));
        Files.writeString(dir.resolve(fileName), content);
    }

    private static FileProcessingResult resultWith(String fileName, String... names) {
        List<Event> events = java.util.Arrays.stream(names)
                .map(n -> Event.builder().name(n).occurrence("2025-06-03", "", "", "").build())
                .toList();
        return new FileProcessingResult(fileName, events, names.length, Map.of(), 0);
    }

    @Test
    @DisplayName("Should process new files and write one output per source")
    void testProcessNewFiles() throws IOException {
        extracted("20250601", "20250601_film_forum.md", "table a");
        extracted("20250601", "20250601_oculus.md", "table b");
        when(processingService.processTable(anyString(), anyString()))
                .thenAnswer(inv -> resultWith(inv.getArgument(1), "Jaws", "Alien"));

        BatchResult result = processor.process(extractedDir, processedDir, null);

        assertEquals(2, result.filesProcessed());
        assertEquals(0, result.filesSkipped());
        assertEquals(4, result.eventsWritten());
        assertFalse(result.hasErrors());
        assertTrue(Files.exists(processedDir.resolve("20250601/film_forum.json")));
        assertTrue(Files.exists(processedDir.resolve("20250601/oculus.json")));
        verify(processingService).processTable("table a", "20250601_film_forum.md");
    }

    @Test
    @DisplayName("Should name undated files after their date directory")
    void testDateDirectoryLayout() throws IOException {
        extracted("20250530", "oculus.md", "table a");
        when(processingService.processTable(anyString(), anyString()))
                .thenAnswer(inv -> resultWith(inv.getArgument(1), "Light Show"));

        BatchResult first = processor.process(extractedDir, processedDir, null);
        BatchResult second = processor.process(extractedDir, processedDir, null);

        assertEquals(1, first.filesProcessed());
        assertTrue(Files.exists(processedDir.resolve("20250530/oculus.json")));
        assertFalse(Files.exists(processedDir.resolve("20250601")));
        verify(processingService, times(1)).processTable("table a", "20250530_oculus.md");
        assertEquals(0, second.filesProcessed());
        assertEquals(1, second.filesSkipped());
    }

    @ParameterizedTest
    @CsvSource({
            "20250530, oculus.md, 20250530_oculus.md",
            "20250530, 20250601_oculus.md, 20250601_oculus.md",
            "drafts, oculus.md, oculus.md"
    })
    @DisplayName("Should prefix the directory date only when the file has none")
    void testSourceName(String dateDir, String fileName, String expected) {
        assertEquals(expected, DirectoryProcessor.sourceName(extractedDir.resolve(dateDir).resolve(fileName)));
    }

    @Test
    @DisplayName("Should skip sources whose output already exists")
    void testSkipExisting() throws IOException {
        extracted("20250601", "20250601_film_forum.md", "table a");
        extracted("20250602", "20250602_oculus.md", "table b");
        Files.createDirectories(processedDir.resolve("20250601"));
        Files.writeString(processedDir.resolve("20250601/film_forum.json"), "[]");
        when(processingService.processTable(anyString(), anyString()))
                .thenAnswer(inv -> resultWith(inv.getArgument(1), "Concert"));

        BatchResult result = processor.process(extractedDir, processedDir, null);

        assertEquals(1, result.filesProcessed());
        assertEquals(1, result.filesSkipped());
        verify(processingService, never()).processTable(anyString(), eq("20250601_film_forum.md"));
        assertEquals("[]", Files.readString(processedDir.resolve("20250601/film_forum.json")));
    }

    @Test
    @DisplayName("Should record a failed file and continue with the rest")
    void testFailedFile() throws IOException {
        extracted("20250601", "20250601_broken.md", "broken");
        extracted("20250601", "20250601_oculus.md", "table b");
        when(processingService.processTable(eq("broken"), anyString()))
                .thenThrow(new IllegalStateException("boom"));
        when(processingService.processTable(eq("table b"), anyString()))
                .thenAnswer(inv -> resultWith(inv.getArgument(1), "Concert"));

        BatchResult result = processor.process(extractedDir, processedDir, null);

        assertEquals(1, result.filesProcessed());
        assertEquals(1, result.filesFailed());
        assertEquals("boom", result.errors().get(0).message());
        assertTrue(result.errors().get(0).sourceFile().endsWith("20250601_broken.md"));
        assertFalse(Files.exists(processedDir.resolve("20250601/broken.json")));
        assertTrue(Files.exists(processedDir.resolve("20250601/oculus.json")));
    }

    @Test
    @DisplayName("Should only visit dated directories and markdown files, in order")
    void testListSources() throws IOException {
        extracted("20250602", "20250602_b.md", "");
        extracted("20250601", "20250601_z.md", "");
        extracted("20250601", "20250601_a.md", "");
        extracted("20250601", "notes.txt", "");
        extracted("drafts", "20250601_c.md", "");

        List<Path> sources = processor.listSources(extractedDir);

        assertEquals(List.of(
                extractedDir.resolve("20250601/20250601_a.md"),
                extractedDir.resolve("20250601/20250601_z.md"),
                extractedDir.resolve("20250602/20250602_b.md")), sources);
        assertTrue(processor.listSources(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    @DisplayName("Should report progress for every file")
    void testProgressCallback() throws IOException {
        extracted("20250601", "20250601_a.md", "table a");
        extracted("20250601", "20250601_b.md", "table b");
        when(processingService.processTable(anyString(), anyString()))
                .thenAnswer(inv -> resultWith(inv.getArgument(1), "Concert"));
        ProgressCallback callback = mock(ProgressCallback.class);

        processor.process(extractedDir, processedDir, callback);

        verify(callback).onProgress(eq(1L), eq(2L), contains("20250601_a.md"));
        verify(callback).onProgress(eq(2L), eq(2L), contains("20250601_b.md"));
    }
}
