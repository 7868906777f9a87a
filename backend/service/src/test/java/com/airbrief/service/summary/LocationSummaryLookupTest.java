package com.airbrief.service.summary;

import com.airbrief.content.generator.ResolvedAlert;
import com.airbrief.content.summary.LocationSummary;
import com.airbrief.content.summary.ResolvedSummary;
import com.airbrief.core.events.AlertContentResolved;
import com.airbrief.service.support.LifecycleHarness;
import com.airbrief.service.support.ScriptedBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationSummaryLookupTest {
    @TempDir
    Path dir;

    private LifecycleHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private LocationSummaryLookup lookup(ScriptedBackend backend) {
        harness = new LifecycleHarness(dir, backend);
        return new LocationSummaryLookup(
                locationId -> Optional.ofNullable(harness.locations.get(locationId)),
                location -> harness.snapshots.get().fetchSnapshot(location),
                harness.summaries
        );
    }

    @Test
    void savedLocationIsSummarizedOnceAndThenServedFromCache() {
        LocationSummaryLookup lookup = lookup(ScriptedBackend.replying(
                "Headline: Moderate air in Boston\nDescription: Sensitive groups should limit long outdoor runs."));

        ResolvedSummary first = lookup.forLocation("boston").orElseThrow();
        ResolvedSummary second = lookup.forLocation("boston").orElseThrow();

        assertEquals(ResolvedAlert.Origin.GENERATED, first.origin());
        assertEquals("Moderate air in Boston", first.summary().headline());
        assertEquals(ResolvedAlert.Origin.CACHE_EXACT, second.origin());
        assertEquals(first.summary(), second.summary());
        assertEquals(1, harness.backend.calls());
        assertEquals(1, harness.summaryCache.stats(5).totalEntries());
        assertEquals(0, harness.cache.stats(5).totalEntries());
        assertEquals("summary", harness.eventsOf(AlertContentResolved.class).get(0).variantId());
    }

    @Test
    void unknownLocationHasNoSummary() {
        LocationSummaryLookup lookup = lookup(ScriptedBackend.replying("Headline: Clear"));

        assertTrue(lookup.forLocation("atlantis").isEmpty());
        assertEquals(0, harness.backend.calls());
    }

    @Test
    void unreadableConditionsFallBackWithoutCallingTheBackend() {
        LocationSummaryLookup lookup = lookup(ScriptedBackend.replying("Headline: Clear"));
        harness.snapshots.set(location -> {
            throw new IllegalStateException("AirNow unavailable");
        });

        ResolvedSummary summary = lookup.forLocation("seattle").orElseThrow();

        assertEquals(ResolvedAlert.Origin.FALLBACK, summary.origin());
        assertEquals(LocationSummary.FALLBACK, summary.summary());
        assertEquals(0, harness.backend.calls());
        assertEquals(0, harness.summaryCache.stats(5).totalEntries());
    }
}
