package com.airbrief.content.cache;

import com.airbrief.core.model.EnvironmentalSnapshot;

import java.time.LocalDate;

public final class SnapshotQuantizer {
    public static final int AQI_STEP = 5;
    public static final int POLLEN_STEP = 2;
    public static final int LIGHTNING_STEP = 10;
    /** Readings above this are treated as this; far beyond any real AQI, pollen or probability. */
    public static final int MAX_READING = 10_000;

    private SnapshotQuantizer() {
    }

    public static CacheBucket quantize(EnvironmentalSnapshot snapshot, LocalDate cacheDate) {
        return new CacheBucket(
                roundToStep(snapshot.aqi(), AQI_STEP),
                roundToStep(snapshot.pollenIndex(), POLLEN_STEP),
                roundToStep(snapshot.stormProbability(), LIGHTNING_STEP),
                cacheDate
        );
    }

    /**
     * Half-up rounding to the nearest multiple of {@code step}; negative sentinels map to 0
     * and readings are capped at {@link #MAX_READING}.
     */
    static int roundToStep(int value, int step) {
        if (value < 0) {
            return 0;
        }
        int capped = Math.min(value, MAX_READING);
        return (int) Math.round(capped / (double) step) * step;
    }
}
