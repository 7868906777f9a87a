package com.airbrief.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Operational problem worth surfacing to the host app (failed refresh, failed sweep).
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    @Override
    public String type() {
        return "AlertRaised";
    }
}
