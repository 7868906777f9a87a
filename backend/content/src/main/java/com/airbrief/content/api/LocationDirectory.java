package com.airbrief.content.api;

import com.airbrief.core.model.LocationRecord;

import java.util.Optional;

@FunctionalInterface
public interface LocationDirectory {
    Optional<LocationRecord> find(String locationId);
}
