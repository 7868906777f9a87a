package com.airbrief.service.notify;

import com.airbrief.core.model.AlertVariant;

import java.time.Instant;
import java.time.LocalTime;

/**
 * The one live platform registration for a (location, variant) pair.
 */
public record ScheduleRecord(
        String locationId,
        String variantId,
        String displayName,
        LocalTime timeOfDay,
        String handle,
        String title,
        String body,
        String contentOrigin,
        Instant scheduledAt
) {
    public ScheduleKey key() {
        return new ScheduleKey(locationId, variantId);
    }

    public AlertVariant variant() {
        return AlertVariant.fromId(variantId);
    }
}
