package com.event.resolution.location;

import java.util.OptionalDouble;

/**
 * One step of the candidate scoring chain. The first scorer that applies to a candidate key
 * decides its score; later scorers are not consulted.
 */
interface CandidateScorer {

    /**
     * @return the score for {@code key}, or empty if this scorer does not apply to it
     */
    OptionalDouble score(String key, NormalizedQuery query);
}
