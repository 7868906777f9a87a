package com.airbrief.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Conditions at one location at one moment. Integer readings use {@link #UNKNOWN} when the
 * provider had nothing to report.
 */
public record EnvironmentalSnapshot(
        String locationId,
        String locationName,
        int aqi,
        int pollenIndex,
        int stormProbability,
        String sourceId,
        Instant observedAt
) {
    public static final int UNKNOWN = -1;

    public EnvironmentalSnapshot {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        if (locationName == null || locationName.isBlank()) {
            locationName = locationId;
        }
    }

    public static EnvironmentalSnapshot unavailable(String locationId, String locationName, String sourceId, Instant observedAt) {
        return new EnvironmentalSnapshot(locationId, locationName, UNKNOWN, UNKNOWN, UNKNOWN, sourceId, observedAt);
    }

    public boolean hasAqi() {
        return aqi >= 0;
    }

    public boolean hasPollen() {
        return pollenIndex >= 0;
    }

    public boolean hasStormProbability() {
        return stormProbability >= 0;
    }

    public String aqiCategory() {
        if (!hasAqi()) {
            return "Unknown";
        }
        if (aqi <= 50) {
            return "Good";
        }
        if (aqi <= 100) {
            return "Moderate";
        }
        if (aqi <= 150) {
            return "Unhealthy for Sensitive Groups";
        }
        if (aqi <= 200) {
            return "Unhealthy";
        }
        if (aqi <= 300) {
            return "Very Unhealthy";
        }
        return "Hazardous";
    }
}
