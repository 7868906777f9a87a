package com.airbrief.core.events;

import java.time.Instant;

public record AlertContentResolved(
        Instant timestamp,
        String locationId,
        String variantId,
        String origin,
        int messageLength
) implements LocationEvent {
    @Override
    public String type() {
        return "AlertContentResolved";
    }
}
