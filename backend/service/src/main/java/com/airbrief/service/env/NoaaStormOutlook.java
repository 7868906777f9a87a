package com.airbrief.service.env;

import java.time.Instant;

/**
 * Thunderstorm chance for the first NOAA forecast period, in percent, or -1 when the
 * forecast mentions thunder but carries no precipitation probability.
 */
public record NoaaStormOutlook(
        int stormProbability,
        String shortForecast,
        Instant periodStart,
        String forecastUrl
) {
}
