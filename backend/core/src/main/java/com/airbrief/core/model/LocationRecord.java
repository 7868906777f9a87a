package com.airbrief.core.model;

import java.util.Objects;

public record LocationRecord(
        String id,
        String name,
        String zip,
        Double lat,
        Double lon
) {
    public LocationRecord {
        Objects.requireNonNull(id, "id is required");
    }

    public boolean hasCoordinates() {
        return lat != null && lon != null;
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
