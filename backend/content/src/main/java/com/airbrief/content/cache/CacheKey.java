package com.airbrief.content.cache;

import java.util.Objects;

public record CacheKey(String locationId, String variantId, String sourceId, CacheBucket bucket) {
    public static final String DELIMITER = "|";

    public CacheKey {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(variantId, "variantId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(bucket, "bucket is required");
    }

    /**
     * {@code locationId|variant|source|aqi|pollen|lightning|yyyy-MM-dd}
     */
    public String serialize() {
        return String.join(DELIMITER,
                locationId,
                variantId,
                sourceId,
                Integer.toString(bucket.aqiLevel()),
                Integer.toString(bucket.pollenLevel()),
                Integer.toString(bucket.lightningLevel()),
                bucket.cacheDate().toString()
        );
    }

    public CachePrefix prefix() {
        return new CachePrefix(locationId, variantId, sourceId, bucket.cacheDate());
    }
}
