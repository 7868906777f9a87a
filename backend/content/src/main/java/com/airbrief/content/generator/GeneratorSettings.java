package com.airbrief.content.generator;

import java.time.Duration;
import java.util.Objects;

/**
 * @param maxChars   hard ceiling on the delivered body
 * @param maxTokens  token budget handed to the backend
 * @param timeout    how long a single backend call may run before the fallback is used
 * @param maxConcurrentCalls size of the worker pool running backend calls
 */
public record GeneratorSettings(int maxChars, int maxTokens, Duration timeout, int maxConcurrentCalls) {
    public static final int PUSH_NOTIFICATION_MAX_CHARS = 178;

    public GeneratorSettings {
        Objects.requireNonNull(timeout, "timeout is required");
        if (maxChars < 10) {
            throw new IllegalArgumentException("maxChars must be >= 10");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be >= 1");
        }
    }

    public static GeneratorSettings defaults() {
        return new GeneratorSettings(PUSH_NOTIFICATION_MAX_CHARS, 60, Duration.ofSeconds(8), 4);
    }
}
