package com.airbrief.service.env;

import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Locale;

public final class NoaaClient {
    public static final URI DEFAULT_BASE_URI = URI.create("https://api.weather.gov");

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration timeout;
    private final Clock clock;
    private final String userAgent;

    public NoaaClient(HttpClient httpClient, Duration timeout, Clock clock, String userAgent) {
        this(httpClient, DEFAULT_BASE_URI, timeout, clock, userAgent);
    }

    public NoaaClient(HttpClient httpClient, URI baseUri, Duration timeout, Clock clock, String userAgent) {
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.timeout = timeout;
        this.clock = clock;
        this.userAgent = userAgent;
    }

    public NoaaStormOutlook stormOutlookFor(double lat, double lon) {
        try {
            JsonNode points = getJson(baseUri.resolve("/points/" + lat + "," + lon));
            String forecastUrl = points.path("properties").path("forecast").asText("");
            if (forecastUrl.isBlank()) {
                throw new IllegalStateException("NOAA points response missing forecast URL");
            }
            JsonNode periods = getJson(URI.create(forecastUrl)).path("properties").path("periods");
            if (!periods.isArray() || periods.isEmpty()) {
                throw new IllegalStateException("NOAA forecast response missing periods");
            }
            JsonNode period = periods.get(0);
            String summary = period.path("shortForecast").asText("");
            String startTime = period.path("startTime").asText("");
            JsonNode pop = period.path("probabilityOfPrecipitation").path("value");
            return new NoaaStormOutlook(
                    stormProbability(summary, pop),
                    summary,
                    startTime.isBlank() ? Instant.now(clock) : OffsetDateTime.parse(startTime).toInstant(),
                    forecastUrl
            );
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("NOAA forecast request interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("NOAA forecast request failed", e);
        }
    }

    static int stormProbability(String shortForecast, JsonNode precipitationProbability) {
        if (!shortForecast.toLowerCase(Locale.ROOT).contains("thunder")) {
            return 0;
        }
        if (!precipitationProbability.isNumber()) {
            return EnvironmentalSnapshot.UNKNOWN;
        }
        return Math.max(0, Math.min(100, precipitationProbability.asInt()));
    }

    private JsonNode getJson(URI uri) throws Exception {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/geo+json,application/json")
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                return JsonUtils.objectMapper().readTree(response.body());
            }
            if (attempts >= 2 || response.statusCode() < 500) {
                throw new IllegalStateException("NOAA request failed with status " + response.statusCode() + " for " + uri);
            }
        }
    }
}
