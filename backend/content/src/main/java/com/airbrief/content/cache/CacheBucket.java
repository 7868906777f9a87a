package com.airbrief.content.cache;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Coarsened conditions for one calendar day. A level of 0 means "no or low signal", which
 * includes readings the provider could not supply.
 */
public record CacheBucket(int aqiLevel, int pollenLevel, int lightningLevel, LocalDate cacheDate) {
    public CacheBucket {
        Objects.requireNonNull(cacheDate, "cacheDate is required");
    }

    /**
     * Manhattan distance over the three levels. The date is not part of the distance.
     */
    public int distanceTo(CacheBucket other) {
        long distance = Math.abs((long) aqiLevel - other.aqiLevel)
                + Math.abs((long) pollenLevel - other.pollenLevel)
                + Math.abs((long) lightningLevel - other.lightningLevel);
        return (int) Math.min(distance, Integer.MAX_VALUE);
    }
}
