package com.event.resolution.location;

import com.event.resolution.similarity.SimilarityAlgorithm;

import java.util.OptionalDouble;

/**
 * Fallback scorer: best similarity of the key against the location, the combined location
 * string and (when long enough) the event name. Always applies.
 */
class EditDistanceScorer implements CandidateScorer {

    private final SimilarityAlgorithm similarity;
    private final int minNameLength;

    EditDistanceScorer(SimilarityAlgorithm similarity, int minNameLength) {
        this.similarity = similarity;
        this.minNameLength = minNameLength;
    }

    @Override
    public OptionalDouble score(String key, NormalizedQuery query) {
        double score = Math.max(similarity.compute(query.location(), key), similarity.compute(query.combined(), key));
        if (query.name().length() > minNameLength) {
            score = Math.max(score, similarity.compute(query.name(), key));
        }
        return OptionalDouble.of(score);
    }
}
