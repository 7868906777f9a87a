package com.airbrief.content.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * @param fuzzyTolerance largest accepted Manhattan distance between quantized levels
 * @param candidateLimit rows examined by the fuzzy phase
 * @param expiryHorizon  lifetime of an entry from creation, regardless of reads
 */
public record CacheSettings(int fuzzyTolerance, int candidateLimit, Duration expiryHorizon) {
    public static final int DEFAULT_FUZZY_TOLERANCE = 15;
    public static final int DEFAULT_CANDIDATE_LIMIT = 5;
    public static final Duration DEFAULT_EXPIRY_HORIZON = Duration.ofHours(24);

    public CacheSettings {
        Objects.requireNonNull(expiryHorizon, "expiryHorizon is required");
        if (fuzzyTolerance < 0) {
            throw new IllegalArgumentException("fuzzyTolerance must be >= 0");
        }
        if (candidateLimit < 1) {
            throw new IllegalArgumentException("candidateLimit must be >= 1");
        }
        if (expiryHorizon.isNegative() || expiryHorizon.isZero()) {
            throw new IllegalArgumentException("expiryHorizon must be positive");
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(DEFAULT_FUZZY_TOLERANCE, DEFAULT_CANDIDATE_LIMIT, DEFAULT_EXPIRY_HORIZON);
    }
}
