package com.airbrief.core.events;

import java.time.Instant;

public record NotificationScheduled(
        Instant timestamp,
        String locationId,
        String variantId,
        String handle,
        int hour,
        int minute,
        boolean recurring
) implements LocationEvent {
    @Override
    public String type() {
        return "NotificationScheduled";
    }
}
