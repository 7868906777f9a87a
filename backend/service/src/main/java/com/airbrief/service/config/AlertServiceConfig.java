package com.airbrief.service.config;

import com.airbrief.content.cache.CacheSettings;
import com.airbrief.content.generator.GeneratorSettings;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Contents of {@code config/alerts.json}. Any section or field left out takes its default.
 */
public record AlertServiceConfig(
        String zoneId,
        String dataDir,
        CacheConfig cache,
        CacheConfig summaryCache,
        GeneratorConfig generator,
        OpenAiConfig openAi,
        MaintenanceConfig maintenance
) {
    public AlertServiceConfig {
        cache = cache == null ? new CacheConfig(null, null, null) : cache;
        summaryCache = summaryCache == null ? new CacheConfig(null, null, null) : summaryCache;
        generator = generator == null ? new GeneratorConfig(null, null, null, null) : generator;
        openAi = openAi == null ? new OpenAiConfig(null, null, null, null) : openAi;
        maintenance = maintenance == null ? new MaintenanceConfig(null, null, null, null) : maintenance;
    }

    public static AlertServiceConfig defaults() {
        return new AlertServiceConfig(null, null, null, null, null, null, null);
    }

    public ZoneId zone() {
        return zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
    }

    public String dataDirOrDefault() {
        return dataDir == null || dataDir.isBlank() ? "data" : dataDir;
    }

    public record CacheConfig(Integer fuzzyTolerance, Integer candidateLimit, Integer expiryHours) {
        public CacheSettings toSettings() {
            return new CacheSettings(
                    fuzzyTolerance == null ? CacheSettings.DEFAULT_FUZZY_TOLERANCE : fuzzyTolerance,
                    candidateLimit == null ? CacheSettings.DEFAULT_CANDIDATE_LIMIT : candidateLimit,
                    expiryHours == null ? CacheSettings.DEFAULT_EXPIRY_HORIZON : Duration.ofHours(expiryHours)
            );
        }
    }

    public record GeneratorConfig(Integer maxChars, Integer maxTokens, Long timeoutMillis, Integer maxConcurrentCalls) {
        public GeneratorSettings toSettings() {
            GeneratorSettings defaults = GeneratorSettings.defaults();
            return new GeneratorSettings(
                    maxChars == null ? defaults.maxChars() : maxChars,
                    maxTokens == null ? defaults.maxTokens() : maxTokens,
                    timeoutMillis == null ? defaults.timeout() : Duration.ofMillis(timeoutMillis),
                    maxConcurrentCalls == null ? defaults.maxConcurrentCalls() : maxConcurrentCalls
            );
        }
    }

    public record OpenAiConfig(String endpoint, String model, Double temperature, Long requestTimeoutMillis) {
        public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/chat/completions";
        public static final String DEFAULT_MODEL = "gpt-3.5-turbo";
        public static final double DEFAULT_TEMPERATURE = 0.7;

        public String endpointOrDefault() {
            return endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
        }

        public String modelOrDefault() {
            return model == null || model.isBlank() ? DEFAULT_MODEL : model;
        }

        public double temperatureOrDefault() {
            return temperature == null ? DEFAULT_TEMPERATURE : temperature;
        }

        public Duration requestTimeout() {
            return requestTimeoutMillis == null ? Duration.ofSeconds(10) : Duration.ofMillis(requestTimeoutMillis);
        }
    }

    public record MaintenanceConfig(
            Long refreshLeadMinutes,
            Long tickSeconds,
            Long sweepIntervalMinutes,
            Integer sweepMaxAgeDays
    ) {
        public Duration refreshLead() {
            return Duration.ofMinutes(refreshLeadMinutes == null ? 10 : refreshLeadMinutes);
        }

        public Duration tickInterval() {
            return Duration.ofSeconds(tickSeconds == null ? 60 : Math.max(1, tickSeconds));
        }

        public Duration sweepInterval() {
            return Duration.ofMinutes(sweepIntervalMinutes == null ? 360 : Math.max(1, sweepIntervalMinutes));
        }

        public int sweepMaxAgeDaysOrDefault() {
            return sweepMaxAgeDays == null ? 2 : sweepMaxAgeDays;
        }
    }
}
