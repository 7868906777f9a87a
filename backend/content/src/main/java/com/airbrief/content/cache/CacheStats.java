package com.airbrief.content.cache;

import java.util.List;

public record CacheStats(int totalEntries, List<CacheEntry> recentEntries) {
    public static CacheStats empty() {
        return new CacheStats(0, List.of());
    }
}
