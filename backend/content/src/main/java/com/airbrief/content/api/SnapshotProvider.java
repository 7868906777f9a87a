package com.airbrief.content.api;

import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.model.LocationRecord;

@FunctionalInterface
public interface SnapshotProvider {
    EnvironmentalSnapshot fetchSnapshot(LocationRecord location);
}
