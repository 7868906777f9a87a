package com.airbrief.service.env;

import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public final class AirNowClient {
    public static final URI DEFAULT_BASE_URI = URI.create("https://www.airnowapi.org");

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration timeout;
    private final Clock clock;
    private final String apiKey;

    public AirNowClient(HttpClient httpClient, Duration timeout, Clock clock, String apiKey) {
        this(httpClient, DEFAULT_BASE_URI, timeout, clock, apiKey);
    }

    public AirNowClient(HttpClient httpClient, URI baseUri, Duration timeout, Clock clock, String apiKey) {
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.timeout = timeout;
        this.clock = clock;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    /**
     * @return empty when no key is configured or AirNow has no numeric reading for the ZIP
     */
    public Optional<AirNowObservation> currentForZip(String zip) {
        if (apiKey.isBlank()) {
            return Optional.empty();
        }
        String normalized = zip == null ? "" : zip.trim();
        if (!normalized.matches("\\d{5}")) {
            throw new IllegalArgumentException("ZIP must be exactly 5 digits: " + zip);
        }

        String query = "format=application/json"
                + "&zipCode=" + URLEncoder.encode(normalized, StandardCharsets.UTF_8)
                + "&distance=25"
                + "&API_KEY=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        URI uri = baseUri.resolve("/aq/observation/zipCode/current/?" + query);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("AirNow request failed with status " + response.statusCode());
            }
            return worstReading(JsonUtils.objectMapper().readTree(response.body()));
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("AirNow request interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("AirNow request failed", e);
        }
    }

    private Optional<AirNowObservation> worstReading(JsonNode root) {
        if (!root.isArray() || root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode worst = null;
        for (JsonNode row : root) {
            JsonNode aqiNode = row.path("AQI");
            if (!aqiNode.isNumber()) {
                continue;
            }
            if (worst == null || aqiNode.asInt() > worst.path("AQI").asInt()) {
                worst = row;
            }
        }
        if (worst == null) {
            return Optional.empty();
        }
        String dateObserved = worst.path("DateObserved").asText("").trim();
        String hourObserved = worst.path("HourObserved").asText("");
        String validDateTime = dateObserved.isBlank() || hourObserved.isBlank()
                ? null
                : dateObserved + " " + hourObserved + ":00";
        return Optional.of(new AirNowObservation(
                worst.path("AQI").asInt(),
                worst.path("Category").path("Name").asText(""),
                worst.path("ParameterName").asText(""),
                Instant.now(clock),
                validDateTime
        ));
    }
}
