package com.airbrief.service.runtime;

import java.time.Instant;
import java.util.Objects;

/**
 * Re-resolve the content of one schedule shortly before it next fires.
 */
public record RefreshJob(String locationId, String variantId, Instant nextFireAt, Instant runAt) {
    public RefreshJob {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(variantId, "variantId is required");
        Objects.requireNonNull(nextFireAt, "nextFireAt is required");
        Objects.requireNonNull(runAt, "runAt is required");
    }

    String key() {
        return locationId + "|" + variantId;
    }
}
