package com.event.resolution.location;

import java.util.OptionalDouble;

/**
 * A key equal to the event name scores a perfect 1.0.
 */
class ExactNameScorer implements CandidateScorer {

    private final int minLength;

    ExactNameScorer(int minLength) {
        this.minLength = minLength;
    }

    @Override
    public OptionalDouble score(String key, NormalizedQuery query) {
        if (query.name().length() > minLength && key.equals(query.name())) {
            return OptionalDouble.of(1.0);
        }
        return OptionalDouble.empty();
    }
}
