package com.airbrief.service.env;

import com.airbrief.content.api.SnapshotProvider;
import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.model.LocationRecord;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a snapshot from AirNow (AQI by ZIP) and NOAA (storm chance by coordinates).
 * Each reading degrades to {@link EnvironmentalSnapshot#UNKNOWN} on its own, so one
 * unavailable upstream never hides the other.
 */
public final class EnvSnapshotProvider implements SnapshotProvider {
    public static final String SOURCE_ID = "airnow";

    private static final Logger LOGGER = Logger.getLogger(EnvSnapshotProvider.class.getName());

    private final Function<String, Optional<AirNowObservation>> aqiLookup;
    private final BiFunction<Double, Double, NoaaStormOutlook> stormLookup;
    private final Function<LocationRecord, OptionalInt> pollenLookup;
    private final Clock clock;

    public EnvSnapshotProvider(AirNowClient airNowClient, NoaaClient noaaClient, Clock clock) {
        this(airNowClient::currentForZip, noaaClient::stormOutlookFor, location -> OptionalInt.empty(), clock);
    }

    public EnvSnapshotProvider(
            Function<String, Optional<AirNowObservation>> aqiLookup,
            BiFunction<Double, Double, NoaaStormOutlook> stormLookup,
            Function<LocationRecord, OptionalInt> pollenLookup,
            Clock clock
    ) {
        this.aqiLookup = aqiLookup;
        this.stormLookup = stormLookup;
        this.pollenLookup = pollenLookup;
        this.clock = clock;
    }

    @Override
    public EnvironmentalSnapshot fetchSnapshot(LocationRecord location) {
        return new EnvironmentalSnapshot(
                location.id(),
                location.displayName(),
                aqi(location),
                pollen(location),
                stormProbability(location),
                SOURCE_ID,
                clock.instant()
        );
    }

    private int aqi(LocationRecord location) {
        if (location.zip() == null || location.zip().isBlank()) {
            return EnvironmentalSnapshot.UNKNOWN;
        }
        try {
            return aqiLookup.apply(location.zip())
                    .map(AirNowObservation::aqi)
                    .orElse(EnvironmentalSnapshot.UNKNOWN);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "AQI unavailable for " + location.id(), e);
            return EnvironmentalSnapshot.UNKNOWN;
        }
    }

    private int stormProbability(LocationRecord location) {
        if (!location.hasCoordinates()) {
            return EnvironmentalSnapshot.UNKNOWN;
        }
        try {
            return stormLookup.apply(location.lat(), location.lon()).stormProbability();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Storm outlook unavailable for " + location.id(), e);
            return EnvironmentalSnapshot.UNKNOWN;
        }
    }

    private int pollen(LocationRecord location) {
        try {
            return pollenLookup.apply(location).orElse(EnvironmentalSnapshot.UNKNOWN);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Pollen index unavailable for " + location.id(), e);
            return EnvironmentalSnapshot.UNKNOWN;
        }
    }
}
