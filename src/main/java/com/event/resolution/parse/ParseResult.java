package com.event.resolution.parse;

import com.event.resolution.core.model.RawRow;

import java.util.List;

/**
 * Rows parsed from one extraction table, in input order.
 *
 * @param rows          accepted rows
 * @param malformedRows lines dropped for a cell count that did not fit the header
 * @param tableFound    false when the text had no header and separator lines
 */
public record ParseResult(List<RawRow> rows, int malformedRows, boolean tableFound) {

    public ParseResult {
        rows = List.copyOf(rows);
    }

    public static ParseResult noTable() {
        return new ParseResult(List.of(), 0, false);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
