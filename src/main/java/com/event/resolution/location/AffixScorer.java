package com.event.resolution.location;

import java.util.OptionalDouble;

/**
 * A key that starts or ends the combined location string scores in {@code [0.9, 0.99]},
 * growing with the share of the string it covers. The longest affix wins, and an affix
 * always beats an edit-distance match without ever reaching an exact name match.
 */
class AffixScorer implements CandidateScorer {

    static final double BASE = 0.9;
    static final double SPAN = 0.09;

    private final int minLength;

    AffixScorer(int minLength) {
        this.minLength = minLength;
    }

    @Override
    public OptionalDouble score(String key, NormalizedQuery query) {
        String combined = query.combined();
        if (key.length() > minLength && (combined.startsWith(key) || combined.endsWith(key))) {
            return OptionalDouble.of(BASE + ((double) key.length() / combined.length()) * SPAN);
        }
        return OptionalDouble.empty();
    }
}
