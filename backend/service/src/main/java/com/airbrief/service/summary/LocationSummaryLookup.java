package com.airbrief.service.summary;

import com.airbrief.content.api.LocationDirectory;
import com.airbrief.content.api.SnapshotProvider;
import com.airbrief.content.generator.ResolvedAlert;
import com.airbrief.content.summary.LocationSummary;
import com.airbrief.content.summary.LocationSummaryService;
import com.airbrief.content.summary.ResolvedSummary;
import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.model.LocationRecord;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the location-card summary for a saved location by id.
 */
public class LocationSummaryLookup {
    private static final Logger LOGGER = Logger.getLogger(LocationSummaryLookup.class.getName());

    private final LocationDirectory locations;
    private final SnapshotProvider snapshots;
    private final LocationSummaryService summaries;

    public LocationSummaryLookup(LocationDirectory locations, SnapshotProvider snapshots, LocationSummaryService summaries) {
        this.locations = Objects.requireNonNull(locations, "locations is required");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
        this.summaries = Objects.requireNonNull(summaries, "summaries is required");
    }

    /**
     * @return empty for an unknown location; the fallback summary when conditions cannot be read
     */
    public Optional<ResolvedSummary> forLocation(String locationId) {
        Optional<LocationRecord> location = locations.find(locationId);
        if (location.isEmpty()) {
            LOGGER.fine(() -> "No saved location " + locationId + " to summarize");
            return Optional.empty();
        }
        EnvironmentalSnapshot snapshot;
        try {
            snapshot = snapshots.fetchSnapshot(location.get());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Snapshot failed for " + locationId + "; summary falls back", e);
            return Optional.of(new ResolvedSummary(LocationSummary.FALLBACK, ResolvedAlert.Origin.FALLBACK));
        }
        return Optional.of(summaries.summarize(snapshot));
    }
}
