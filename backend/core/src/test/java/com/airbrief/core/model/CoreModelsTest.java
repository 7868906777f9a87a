package com.airbrief.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsTest {
    private static final Instant NOW = Instant.parse("2026-03-01T07:00:00Z");

    @Test
    void unavailableSnapshotCarriesSentinelReadings() {
        EnvironmentalSnapshot snapshot = EnvironmentalSnapshot.unavailable("loc-1", "Boston", "airnow", NOW);

        assertEquals(EnvironmentalSnapshot.UNKNOWN, snapshot.aqi());
        assertFalse(snapshot.hasAqi());
        assertFalse(snapshot.hasPollen());
        assertFalse(snapshot.hasStormProbability());
        assertEquals("Unknown", snapshot.aqiCategory());
    }

    @Test
    void blankLocationNameFallsBackToId() {
        EnvironmentalSnapshot snapshot = new EnvironmentalSnapshot("loc-1", " ", 42, 3, 10, "airnow", NOW);
        assertEquals("loc-1", snapshot.locationName());
        assertTrue(snapshot.hasAqi());
        assertEquals("Good", snapshot.aqiCategory());
    }

    @Test
    void aqiCategoriesFollowEpaBreakpoints() {
        assertEquals("Moderate", at(51).aqiCategory());
        assertEquals("Unhealthy for Sensitive Groups", at(101).aqiCategory());
        assertEquals("Unhealthy", at(200).aqiCategory());
        assertEquals("Very Unhealthy", at(250).aqiCategory());
        assertEquals("Hazardous", at(301).aqiCategory());
    }

    @Test
    void variantIdsRoundTripThroughFromId() {
        assertSame(AlertVariant.MORNING, AlertVariant.fromId("morning"));
        assertSame(AlertVariant.EVENING, AlertVariant.fromId("evening"));
        AlertVariant custom = AlertVariant.custom("abc");
        assertEquals("custom-abc", custom.id());
        assertEquals(custom, AlertVariant.fromId("custom-abc"));
        assertEquals(AlertKind.CUSTOM, custom.kind());
    }

    @Test
    void variantRejectsUnknownIdsAndDelimiter() {
        assertThrows(IllegalArgumentException.class, () -> AlertVariant.fromId("noon"));
        assertThrows(IllegalArgumentException.class, () -> AlertVariant.fromId("custom-"));
        assertThrows(IllegalArgumentException.class, () -> AlertVariant.custom("a|b"));
    }

    private static EnvironmentalSnapshot at(int aqi) {
        return new EnvironmentalSnapshot("loc-1", "Boston", aqi, 0, 0, "airnow", NOW);
    }
}
