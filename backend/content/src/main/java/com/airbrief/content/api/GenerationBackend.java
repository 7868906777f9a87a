package com.airbrief.content.api;

/**
 * Expensive, rate-limited text generation call. May throw or hang; callers bound it.
 */
@FunctionalInterface
public interface GenerationBackend {
    String generate(String systemPrompt, String userPrompt, int maxTokens);
}
