package com.airbrief.core.events;

import java.time.Instant;
import java.time.LocalDate;

public record CacheSwept(
        Instant timestamp,
        LocalDate cutoffDate,
        int deleted
) implements Event {
    @Override
    public String type() {
        return "CacheSwept";
    }
}
