package com.event.resolution.bulk;

import java.util.List;

/**
 * Result of processing a directory of extracted files.
 *
 * @param filesProcessed files turned into a processed event file
 * @param filesSkipped   files whose output already existed
 * @param eventsWritten  events written across all processed files
 * @param errors         files that failed, with the reason
 */
public record BatchResult(
        long filesProcessed,
        long filesSkipped,
        long eventsWritten,
        List<FileError> errors
) {
    public BatchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long filesFailed() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A source file that could not be processed.
     *
     * @param sourceFile path of the extracted file
     * @param message    the error message
     */
    public record FileError(String sourceFile, String message) {}

    @Override
    public String toString() {
        return "BatchResult{processed=" + filesProcessed +
                ", skipped=" + filesSkipped +
                ", events=" + eventsWritten +
                ", errors=" + errors.size() + '}';
    }
}
