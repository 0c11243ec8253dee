package com.event.resolution.parse;

import com.event.resolution.core.model.RawRow;
import com.event.resolution.text.IsoDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the pipe-delimited table returned by the extraction service.
 *
 * <p>The first line is the header and is always read as {@link RawRow#COLUMNS}, whatever it
 * says; the second line is the separator. Data lines are split on {@code |} with surrounding
 * whitespace trimmed. Two irregular shapes are repaired:</p>
 * <ul>
 *   <li>one cell too many, with a valid date in the start-date position once the first two
 *       cells are joined: the name contained a literal pipe and the cells are rejoined with
 *       {@code " | "}</li>
 *   <li>one cell too few on a line ending in {@code |}: the trailing emoji cell is missing
 *       and is read as empty</li>
 * </ul>
 * Any other cell count mismatch drops the line.
 */
public class TableParser {
    private static final Logger log = LoggerFactory.getLogger(TableParser.class);

    private static final Pattern CELL_SEPARATOR = Pattern.compile("\\s*\\|\\s*");
    private static final int COLUMN_COUNT = RawRow.COLUMNS.size();
    private static final int START_DATE_INDEX_WITH_EXTRA_CELL = RawRow.COLUMNS.indexOf("start_date") + 1;

    public ParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return ParseResult.noTable();
        }
        String[] lines = text.strip().split("\n", -1);
        if (lines.length < 2) {
            log.debug("No table found: fewer than two lines");
            return ParseResult.noTable();
        }
        String header = lines[0].strip();
        if (!splitCells(header).equals(RawRow.COLUMNS)) {
            log.debug("Unexpected table header '{}', reading canonical columns", header);
        }

        List<RawRow> rows = new ArrayList<>();
        int malformed = 0;
        for (int i = 2; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("|---")) {
                continue;
            }
            List<String> cells = splitCells(line);
            if (cells.size() == COLUMN_COUNT + 1) {
                if (!IsoDates.isValid(cells.get(START_DATE_INDEX_WITH_EXTRA_CELL))) {
                    malformed++;
                    log.debug("Dropping row with {} cells: {}", cells.size(), line);
                    continue;
                }
                List<String> merged = new ArrayList<>(COLUMN_COUNT);
                merged.add(cells.get(0) + " | " + cells.get(1));
                merged.addAll(cells.subList(2, cells.size()));
                cells = merged;
            } else if (cells.size() != COLUMN_COUNT && !isMissingTrailingField(cells, line)) {
                malformed++;
                log.debug("Dropping row with {} cells: {}", cells.size(), line);
                continue;
            }
            rows.add(RawRow.fromCells(cells));
        }
        return new ParseResult(rows, malformed, true);
    }

    private static boolean isMissingTrailingField(List<String> cells, String line) {
        return cells.size() == COLUMN_COUNT - 1 && line.endsWith("|");
    }

    static List<String> splitCells(String line) {
        String trimmed = stripPipes(line.strip());
        return Arrays.stream(CELL_SEPARATOR.split(trimmed, -1))
                .map(String::strip)
                .toList();
    }

    private static String stripPipes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '|') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '|') {
            end--;
        }
        return s.substring(start, end);
    }
}
