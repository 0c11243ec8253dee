package com.event.resolution.core.model;

/**
 * Why a table row or event was left out of the output.
 */
public enum DropReason {
    /** Cell count did not fit the table header. */
    MALFORMED_ROW,
    /** Missing or unparseable start or end date. */
    UNPARSEABLE_DATE,
    /** No overlap with the look-ahead window. */
    OUT_OF_WINDOW,
    /** Span longer than the maximum event duration. */
    TOO_LONG,
    /** Carries a tag from the remove set. */
    REMOVED_TAG,
    /** Cancelled or otherwise withdrawn listing. */
    CANCELLED
}
