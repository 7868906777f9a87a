package com.airbrief.content.generator;

public record ResolvedAlert(String message, Origin origin) {
    public enum Origin {
        CACHE_EXACT,
        CACHE_FUZZY,
        GENERATED,
        FALLBACK
    }
}
