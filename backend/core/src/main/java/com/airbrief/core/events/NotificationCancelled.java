package com.airbrief.core.events;

import java.time.Instant;

public record NotificationCancelled(
        Instant timestamp,
        String locationId,
        String variantId,
        String handle
) implements LocationEvent {
    @Override
    public String type() {
        return "NotificationCancelled";
    }
}
