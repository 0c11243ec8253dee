package com.event.resolution.core.model;

/**
 * Which step of the location matching cascade produced a resolution.
 */
public enum MatchKind {
    /** Exact hit on "location sublocation". */
    EXACT_COMBINED,
    /** Exact hit on the location text alone. */
    EXACT_LOCATION,
    /** Exact hit on the event name. */
    EXACT_NAME,
    /** Best scored candidate from the partial-match scan. */
    SCORED,
    /** Scored match against the source site name. */
    SOURCE_SITE
}
