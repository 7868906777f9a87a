package com.airbrief.content.cache;

import com.airbrief.core.model.AlertVariant;
import com.airbrief.core.model.EnvironmentalSnapshot;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

public final class CacheKeyBuilder {
    static final String UNKNOWN_SOURCE = "unknown";

    private final Clock clock;

    /**
     * @param clock supplies both "now" and the calendar zone used for the cache date
     */
    public CacheKeyBuilder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public CacheKey build(EnvironmentalSnapshot snapshot, AlertVariant variant) {
        return build(snapshot, variant.id());
    }

    /**
     * @param variantId the key segment; alert variant ids, or a fixed name for non-alert content
     */
    public CacheKey build(EnvironmentalSnapshot snapshot, String variantId) {
        return new CacheKey(
                snapshot.locationId(),
                variantId,
                normalizeSource(snapshot.sourceId()),
                SnapshotQuantizer.quantize(snapshot, today())
        );
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private static String normalizeSource(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            return UNKNOWN_SOURCE;
        }
        return sourceId.trim().toLowerCase(Locale.ROOT).replace(CacheKey.DELIMITER, "_");
    }
}
