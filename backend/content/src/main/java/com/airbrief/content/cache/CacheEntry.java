package com.airbrief.content.cache;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One generated message, stored flat so stores can index the individual key columns.
 */
public record CacheEntry(
        String cacheKey,
        String locationId,
        String variantId,
        String sourceId,
        int aqiLevel,
        int pollenLevel,
        int lightningLevel,
        LocalDate cacheDate,
        String message,
        Instant createdAt,
        Instant expiresAt,
        Instant lastAccessedAt,
        int accessCount
) {
    public CacheEntry {
        Objects.requireNonNull(cacheKey, "cacheKey is required");
        Objects.requireNonNull(cacheDate, "cacheDate is required");
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public static CacheEntry create(CacheKey key, String message, Instant createdAt, Duration expiryHorizon) {
        CacheBucket bucket = key.bucket();
        return new CacheEntry(
                key.serialize(),
                key.locationId(),
                key.variantId(),
                key.sourceId(),
                bucket.aqiLevel(),
                bucket.pollenLevel(),
                bucket.lightningLevel(),
                bucket.cacheDate(),
                message,
                createdAt,
                createdAt.plus(expiryHorizon),
                createdAt,
                1
        );
    }

    public CacheBucket bucket() {
        return new CacheBucket(aqiLevel, pollenLevel, lightningLevel, cacheDate);
    }

    public boolean isValidAt(Instant instant) {
        return expiresAt.isAfter(instant);
    }

    public CacheEntry touched(Instant accessedAt) {
        return new CacheEntry(
                cacheKey,
                locationId,
                variantId,
                sourceId,
                aqiLevel,
                pollenLevel,
                lightningLevel,
                cacheDate,
                message,
                createdAt,
                expiresAt,
                accessedAt,
                accessCount + 1
        );
    }
}
