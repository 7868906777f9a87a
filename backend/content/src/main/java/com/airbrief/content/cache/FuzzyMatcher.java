package com.airbrief.content.cache;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the candidate closest to a target bucket. Equal distances go to the most recently
 * created entry; anything beyond the tolerance is rejected.
 */
public final class FuzzyMatcher {
    private static final Comparator<Match> CLOSEST_THEN_NEWEST = Comparator
            .comparingInt(Match::distance)
            .thenComparing(match -> match.entry().createdAt(), Comparator.reverseOrder());

    private final int tolerance;

    public FuzzyMatcher(int tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        this.tolerance = tolerance;
    }

    public int tolerance() {
        return tolerance;
    }

    public Optional<Match> closest(CacheBucket target, List<CacheEntry> candidates) {
        return candidates.stream()
                .map(entry -> new Match(entry, target.distanceTo(entry.bucket())))
                .min(CLOSEST_THEN_NEWEST)
                .filter(match -> match.distance() <= tolerance);
    }

    public record Match(CacheEntry entry, int distance) {
    }
}
