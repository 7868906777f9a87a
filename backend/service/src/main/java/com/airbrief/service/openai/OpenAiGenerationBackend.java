package com.airbrief.service.openai;

import com.airbrief.content.api.GenerationBackend;
import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Chat-completions client. One request per call, no retries; the generator bounds the wait.
 */
public final class OpenAiGenerationBackend implements GenerationBackend {
    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final Duration timeout;

    public OpenAiGenerationBackend(
            HttpClient httpClient,
            URI endpoint,
            String apiKey,
            String model,
            double temperature,
            Duration timeout
    ) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.temperature = temperature;
        this.timeout = timeout;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, int maxTokens) {
        if (apiKey.isBlank()) {
            throw new IllegalStateException("OpenAI API key not configured");
        }
        ChatRequest body = new ChatRequest(
                model,
                List.of(new ChatMessage("system", systemPrompt), new ChatMessage("user", userPrompt)),
                maxTokens,
                temperature
        );
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.objectMapper().writeValueAsString(body)))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("OpenAI request failed with status " + response.statusCode());
            }
            return firstChoice(JsonUtils.objectMapper().readTree(response.body()));
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("OpenAI request interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("OpenAI request failed", e);
        }
    }

    private static String firstChoice(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("OpenAI response has no choices");
        }
        return choices.get(0).path("message").path("content").asText("");
    }

    record ChatRequest(
            String model,
            List<ChatMessage> messages,
            @JsonProperty("max_tokens") int maxTokens,
            double temperature
    ) {
    }

    record ChatMessage(String role, String content) {
    }
}
