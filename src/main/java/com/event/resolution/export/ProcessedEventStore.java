package com.event.resolution.export;

import com.event.resolution.core.model.Event;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads and writes per-source event files laid out as {@code processed/YYYYMMDD/<site>.json}.
 *
 * <p>The date directory comes from the {@code YYYYMMDD_} prefix of the source file name, or
 * today's date when there is none; the prefix and extension are dropped from the output name.
 * Files are indented UTF-8 JSON arrays with non-ASCII characters left as is.</p>
 */
public class ProcessedEventStore {
    private static final Logger log = LoggerFactory.getLogger(ProcessedEventStore.class);

    private static final Pattern DATE_PREFIX = Pattern.compile("^(\\d{8})_");
    private static final DateTimeFormatter DIRECTORY_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final TypeReference<List<Event>> EVENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final Clock clock;

    public ProcessedEventStore(Clock clock) {
        this(new ObjectMapper(), clock);
    }

    public ProcessedEventStore(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.writer = mapper.writer().with(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Output path for the events extracted from {@code sourceFileName}.
     */
    public Path outputPath(Path processedDir, String sourceFileName) {
        Matcher m = DATE_PREFIX.matcher(sourceFileName);
        String date = m.find() ? m.group(1) : LocalDate.now(clock).format(DIRECTORY_DATE);
        String baseName = DATE_PREFIX.matcher(sourceFileName).replaceFirst("");
        return processedDir.resolve(date).resolve(stripExtension(baseName) + ".json");
    }

    /**
     * Writes the events of one source file, replacing any earlier output.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path write(Path processedDir, String sourceFileName, List<Event> events) {
        Path target = outputPath(processedDir, sourceFileName);
        writeJson(target, events);
        log.debug("Wrote {} events to {}", events.size(), target);
        return target;
    }

    public List<Event> read(Path file) throws IOException {
        List<Event> events = mapper.readValue(file.toFile(), EVENT_LIST);
        return events != null ? events : List.of();
    }

    /**
     * All {@code *.json} files one directory level below {@code processedDir}, sorted by path.
     */
    public List<Path> listProcessedFiles(Path processedDir) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(processedDir)) {
            return files;
        }
        try (Stream<Path> dirs = Files.list(processedDir)) {
            for (Path dir : dirs.filter(Files::isDirectory).sorted().toList()) {
                try (Stream<Path> entries = Files.list(dir)) {
                    entries.filter(p -> p.getFileName().toString().endsWith(".json"))
                            .filter(Files::isRegularFile)
                            .sorted()
                            .forEach(files::add);
                }
            }
        }
        return files;
    }

    /**
     * Writes any value as indented JSON, creating parent directories.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void writeJson(Path target, Object value) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer.writeValue(target.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
