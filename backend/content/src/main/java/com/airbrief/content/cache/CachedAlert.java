package com.airbrief.content.cache;

import java.time.Instant;

public record CachedAlert(String message, MatchType matchType, int distance, String cacheKey, Instant generatedAt) {
}
