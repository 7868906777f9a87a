package com.airbrief.core.events;

import java.time.Instant;

public record NotificationDelivered(
        Instant timestamp,
        String locationId,
        String variantId,
        String handle
) implements LocationEvent {
    @Override
    public String type() {
        return "NotificationDelivered";
    }
}
