package com.airbrief.service.notify;

import java.util.Objects;

public record ScheduleKey(String locationId, String variantId) {
    public ScheduleKey {
        Objects.requireNonNull(locationId, "locationId is required");
        Objects.requireNonNull(variantId, "variantId is required");
    }

    public String asString() {
        return locationId + "|" + variantId;
    }
}
