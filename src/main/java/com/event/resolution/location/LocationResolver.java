package com.event.resolution.location;

import com.event.resolution.cache.CachedLocation;
import com.event.resolution.cache.NoOpResolutionCache;
import com.event.resolution.cache.ResolutionCache;
import com.event.resolution.core.model.LocationMatch;
import com.event.resolution.core.model.LocationQuery;
import com.event.resolution.core.model.LocationResolution;
import com.event.resolution.core.model.MatchKind;
import com.event.resolution.metrics.MetricsService;
import com.event.resolution.metrics.NoOpMetricsService;
import com.event.resolution.similarity.LevenshteinSimilarity;
import com.event.resolution.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Maps raw venue text to a registry location.
 *
 * <p>Matching cascade, first hit wins:</p>
 * <ol>
 *   <li>exact key for "location sublocation"</li>
 *   <li>exact key for the location alone</li>
 *   <li>exact key for the event name</li>
 *   <li>best scored candidate over all keys (exact name, then affix, then edit distance)</li>
 *   <li>best edit-distance match of the source site name against every key</li>
 * </ol>
 * <p>Scored steps accept only scores at or above the threshold; ties keep the key seen first.
 * Query strings must be longer than {@code minQueryLength} to take part in exact and
 * affix matching.</p>
 */
public class LocationResolver {
    private static final Logger log = LoggerFactory.getLogger(LocationResolver.class);

    public static final double DEFAULT_THRESHOLD = 0.85;

    private final LocationIndex index;
    private final double threshold;
    private final int minQueryLength;
    private final SimilarityAlgorithm similarity;
    private final List<CandidateScorer> scorers;
    private final ResolutionCache cache;
    private final MetricsService metrics;

    private LocationResolver(Builder builder) {
        this.index = Objects.requireNonNull(builder.index, "index is required");
        this.threshold = builder.threshold;
        this.minQueryLength = builder.minQueryLength;
        this.similarity = builder.similarity;
        this.cache = builder.cache;
        this.metrics = builder.metrics;
        this.scorers = List.of(
                new ExactNameScorer(minQueryLength),
                new AffixScorer(minQueryLength),
                new EditDistanceScorer(similarity, minQueryLength));
    }

    public static Builder builder(LocationIndex index) {
        return new Builder(index);
    }

    /**
     * Resolves a query, consulting the cache first. An unresolved venue is logged for
     * registry maintenance and returned as empty.
     */
    public Optional<LocationResolution> resolve(LocationQuery query) {
        Optional<LocationResolution> result;
        Optional<CachedLocation> cached = cache.get(query);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            result = cached.get().asOptional();
        } else {
            metrics.recordCacheMiss();
            result = match(query);
            cache.put(query, new CachedLocation(result.orElse(null)));
        }

        if (result.isPresent()) {
            LocationResolution resolution = result.get();
            metrics.recordLocationResolved(resolution.kind());
            metrics.recordMatchScore(resolution.score());
            log.debug("location.resolved location={} key='{}' kind={} score={}",
                    query.describe(), resolution.matchedKey(), resolution.kind(), resolution.score());
        } else {
            metrics.recordLocationUnresolved();
            log.info("location.unresolved event='{}' location={} site='{}'",
                    query.eventName(), query.describe(), query.sourceSiteName());
        }
        return result;
    }

    /**
     * Runs the matching cascade without touching cache or metrics.
     */
    public Optional<LocationResolution> match(LocationQuery query) {
        NormalizedQuery normalized = NormalizedQuery.of(query);
        String combined = normalized.combined();

        if (combined.length() > minQueryLength) {
            Optional<LocationMatch> hit = index.get(combined);
            if (hit.isPresent()) {
                return Optional.of(LocationResolution.exact(hit.get(), combined, MatchKind.EXACT_COMBINED));
            }
            hit = index.get(normalized.location());
            if (hit.isPresent()) {
                return Optional.of(LocationResolution.exact(hit.get(), normalized.location(), MatchKind.EXACT_LOCATION));
            }
        }
        if (normalized.name().length() > minQueryLength) {
            Optional<LocationMatch> hit = index.get(normalized.name());
            if (hit.isPresent()) {
                return Optional.of(LocationResolution.exact(hit.get(), normalized.name(), MatchKind.EXACT_NAME));
            }
        }

        if (combined.length() > minQueryLength || normalized.name().length() > minQueryLength) {
            Optional<LocationResolution> scored = bestCandidate(normalized);
            if (scored.isPresent()) {
                return scored;
            }
        }
        return bestSourceSiteMatch(LocationNameNormalizer.normalize(query.sourceSiteName()));
    }

    private Optional<LocationResolution> bestCandidate(NormalizedQuery query) {
        String bestKey = null;
        double bestScore = -1;
        for (String key : index.keys()) {
            if (key.isBlank() || !isCandidate(key, query)) {
                continue;
            }
            double score = score(key, query);
            log.trace("Candidate '{}' scored {}", key, score);
            if (score >= threshold && score > bestScore) {
                bestScore = score;
                bestKey = key;
            }
        }
        return toResolution(bestKey, bestScore, MatchKind.SCORED);
    }

    private Optional<LocationResolution> bestSourceSiteMatch(String site) {
        if (site.isEmpty()) {
            return Optional.empty();
        }
        String bestKey = null;
        double bestScore = -1;
        for (String key : index.keys()) {
            double score = similarity.compute(site, index.normalizedKey(key));
            if (score >= threshold && score > bestScore) {
                bestScore = score;
                bestKey = key;
            }
        }
        return toResolution(bestKey, bestScore, MatchKind.SOURCE_SITE);
    }

    private Optional<LocationResolution> toResolution(String key, double score, MatchKind kind) {
        if (key == null) {
            return Optional.empty();
        }
        return index.get(key).map(match -> new LocationResolution(match, key, kind, score));
    }

    boolean isCandidate(String key, NormalizedQuery query) {
        String combined = query.combined();
        boolean longKey = key.length() > minQueryLength;
        return key.equals(query.location())
                || (query.name().length() > minQueryLength && key.equals(query.name()))
                || (longKey && combined.contains(key))
                || (query.location().length() > minQueryLength && key.contains(query.location()))
                || (query.sublocation().length() > minQueryLength && key.contains(query.sublocation()));
    }

    double score(String key, NormalizedQuery query) {
        for (CandidateScorer scorer : scorers) {
            OptionalDouble score = scorer.score(key, query);
            if (score.isPresent()) {
                return score.getAsDouble();
            }
        }
        return 0.0;
    }

    public double getThreshold() {
        return threshold;
    }

    public static class Builder {
        private final LocationIndex index;
        private double threshold = DEFAULT_THRESHOLD;
        private int minQueryLength = LocationIndex.DEFAULT_MIN_KEY_LENGTH;
        private SimilarityAlgorithm similarity = new LevenshteinSimilarity();
        private ResolutionCache cache = new NoOpResolutionCache();
        private MetricsService metrics = new NoOpMetricsService();

        private Builder(LocationIndex index) {
            this.index = index;
        }

        public Builder threshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder minQueryLength(int minQueryLength) {
            if (minQueryLength < 0) {
                throw new IllegalArgumentException("minQueryLength must be >= 0");
            }
            this.minQueryLength = minQueryLength;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = Objects.requireNonNull(similarity);
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.cache = Objects.requireNonNull(cache);
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics);
            return this;
        }

        public LocationResolver build() {
            return new LocationResolver(this);
        }
    }
}
