package com.airbrief.service.prefs;

import com.airbrief.core.model.AlertVariant;

import java.time.LocalTime;
import java.util.Objects;

public record CustomAlert(String id, String name, LocalTime time, boolean enabled) {
    public CustomAlert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(time, "time is required");
    }

    public AlertVariant variant() {
        return AlertVariant.custom(id);
    }
}
