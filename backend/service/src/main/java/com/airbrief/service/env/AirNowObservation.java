package com.airbrief.service.env;

import java.time.Instant;

/**
 * Highest pollutant AQI reported by AirNow for a ZIP code.
 */
public record AirNowObservation(
        int aqi,
        String category,
        String parameter,
        Instant fetchedAt,
        String validDateTime
) {
}
