package com.airbrief.content.cache;

import java.time.LocalDate;

/**
 * The part of a {@link CacheKey} that fuzzy matching holds fixed.
 */
public record CachePrefix(String locationId, String variantId, String sourceId, LocalDate cacheDate) {
    public boolean matches(CacheEntry entry) {
        return locationId.equals(entry.locationId())
                && variantId.equals(entry.variantId())
                && sourceId.equals(entry.sourceId())
                && cacheDate.equals(entry.cacheDate());
    }
}
