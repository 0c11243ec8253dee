package com.event.resolution.bulk;

import com.event.resolution.api.EventProcessingService;
import com.event.resolution.api.FileProcessingResult;
import com.event.resolution.export.ProcessedEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Processes every extracted file under {@code extracted/YYYYMMDD/*.md} that has no processed
 * output yet.
 *
 * <p>Date directories are visited in name order, files within them likewise. A file that
 * fails is logged and recorded in the {@link BatchResult}; the batch carries on with the next
 * file and no output is written for the failed one.</p>
 */
public class DirectoryProcessor {
    private static final Logger log = LoggerFactory.getLogger(DirectoryProcessor.class);

    private static final String DATE_DIRECTORY = "\\d{8}";
    private static final Pattern DATE_PREFIX = Pattern.compile("\\d{8}_");
    private static final String EXTRACTED_SUFFIX = ".md";

    private final EventProcessingService processingService;
    private final ProcessedEventStore store;

    public DirectoryProcessor(EventProcessingService processingService, ProcessedEventStore store) {
        this.processingService = processingService;
        this.store = store;
    }

    /**
     * @throws UncheckedIOException if the extracted directory cannot be listed
     */
    public BatchResult process(Path extractedDir, Path processedDir, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<Path> sources = listSources(extractedDir);
        List<BatchResult.FileError> errors = new ArrayList<>();

        long processed = 0;
        long skipped = 0;
        long events = 0;
        long handled = 0;
        for (Path source : sources) {
            String fileName = sourceName(source);
            Path target = store.outputPath(processedDir, fileName);
            handled++;
            if (Files.exists(target)) {
                skipped++;
                log.debug("Skipping {}: output {} already exists", fileName, target);
                cb.onProgress(handled, sources.size(), "Skipped " + fileName);
                continue;
            }
            try {
                String text = Files.readString(source, StandardCharsets.UTF_8);
                FileProcessingResult result = processingService.processTable(text, fileName);
                store.write(processedDir, fileName, result.events());
                processed++;
                events += result.events().size();
                cb.onProgress(handled, sources.size(), "Processed " + fileName);
            } catch (IOException | RuntimeException e) {
                errors.add(new BatchResult.FileError(source.toString(), e.getMessage()));
                log.warn("file.failed source={} error={}", source, e.toString());
                cb.onProgress(handled, sources.size(), "Failed " + fileName);
            }
        }

        BatchResult result = new BatchResult(processed, skipped, events, errors);
        log.info("batch.completed result={}", result);
        return result;
    }

    /**
     * Name of an extracted file as the pipeline sees it: {@code YYYYMMDD_<site>.md}. Files laid
     * out as {@code extracted/YYYYMMDD/<site>.md} take the date of their directory, so the site
     * fallback and the output directory both follow the extraction date.
     */
    static String sourceName(Path source) {
        String fileName = source.getFileName().toString();
        Path parent = source.getParent();
        if (DATE_PREFIX.matcher(fileName).lookingAt() || parent == null || parent.getFileName() == null) {
            return fileName;
        }
        String dateDir = parent.getFileName().toString();
        return dateDir.matches(DATE_DIRECTORY) ? dateDir + "_" + fileName : fileName;
    }

    List<Path> listSources(Path extractedDir) {
        List<Path> sources = new ArrayList<>();
        if (!Files.isDirectory(extractedDir)) {
            log.warn("batch.missing directory={}", extractedDir);
            return sources;
        }
        try (Stream<Path> dirs = Files.list(extractedDir)) {
            List<Path> dateDirs = dirs.filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().matches(DATE_DIRECTORY))
                    .sorted()
                    .toList();
            for (Path dir : dateDirs) {
                try (Stream<Path> files = Files.list(dir)) {
                    files.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(EXTRACTED_SUFFIX))
                            .sorted()
                            .forEach(sources::add);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + extractedDir, e);
        }
        return sources;
    }
}
