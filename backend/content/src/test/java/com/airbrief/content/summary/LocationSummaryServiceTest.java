package com.airbrief.content.summary;

import com.airbrief.content.cache.CacheSettings;
import com.airbrief.content.cache.ContentCache;
import com.airbrief.content.generator.AlertContentResolver;
import com.airbrief.content.generator.AlertGenerator;
import com.airbrief.content.generator.GeneratorSettings;
import com.airbrief.content.generator.ResolvedAlert;
import com.airbrief.content.support.InMemoryContentStore;
import com.airbrief.content.support.ScriptedBackend;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.AlertContentResolved;
import com.airbrief.core.model.AlertVariant;
import com.airbrief.core.model.EnvironmentalSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationSummaryServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T15:00:00Z"), ZoneOffset.UTC);
    private static final String REPLY = "Headline: Sneezy Skies\nDescription: Clean air, but pollen is up. Pack tissues!";

    private final InMemoryContentStore store = new InMemoryContentStore();
    private final EventBus eventBus = new EventBus();
    private final List<AlertContentResolved> resolvedEvents = new ArrayList<>();
    private AlertGenerator generator;

    @AfterEach
    void closeGenerator() {
        if (generator != null) {
            generator.close();
        }
    }

    @Test
    void generatesOnceAndReusesForSimilarConditions() {
        ScriptedBackend backend = ScriptedBackend.replying(REPLY);
        LocationSummaryService service = service(backend, CacheSettings.defaults());

        ResolvedSummary first = service.summarize(snapshot(52, 3, 12));
        ResolvedSummary second = service.summarize(snapshot(54, 4, 18));
        ResolvedSummary third = service.summarize(snapshot(52, 3, 12));

        assertEquals(ResolvedAlert.Origin.GENERATED, first.origin());
        assertEquals(new LocationSummary("Sneezy Skies", "Clean air, but pollen is up. Pack tissues!"), first.summary());
        assertEquals(ResolvedAlert.Origin.CACHE_FUZZY, second.origin());
        assertEquals(first.summary(), second.summary());
        assertEquals(ResolvedAlert.Origin.CACHE_EXACT, third.origin());
        assertEquals(1, backend.calls());
        assertTrue(backend.userPrompts().get(0).contains("Air Quality Index: 52 (Moderate)"));
        assertEquals(List.of("summary", "summary", "summary"),
                resolvedEvents.stream().map(AlertContentResolved::variantId).toList());
    }

    @Test
    void summaryCacheUsesItsOwnTolerance() {
        ScriptedBackend backend = ScriptedBackend.replying(REPLY);
        LocationSummaryService strict = service(backend, new CacheSettings(10, 5, Duration.ofHours(24)));

        strict.summarize(snapshot(52, 3, 12));
        ResolvedSummary second = strict.summarize(snapshot(54, 4, 18));

        assertEquals(ResolvedAlert.Origin.GENERATED, second.origin());
        assertEquals(2, backend.calls());
    }

    @Test
    void unusableReplyFallsBackWithoutCaching() {
        ScriptedBackend backend = ScriptedBackend.replying("The air is nice.");
        LocationSummaryService service = service(backend, CacheSettings.defaults());

        ResolvedSummary resolved = service.summarize(snapshot(52, 3, 12));

        assertEquals(ResolvedAlert.Origin.FALLBACK, resolved.origin());
        assertEquals(LocationSummary.FALLBACK, resolved.summary());
        assertTrue(store.entries().isEmpty());
    }

    @Test
    void backendFailureFallsBack() {
        LocationSummaryService service = service(ScriptedBackend.failing(), CacheSettings.defaults());

        assertEquals(LocationSummary.FALLBACK, service.summarize(snapshot(52, 3, 12)).summary());
    }

    @Test
    void summariesAndAlertsShareAStoreWithoutColliding() {
        ScriptedBackend backend = ScriptedBackend.replying(REPLY);
        LocationSummaryService service = service(backend, CacheSettings.defaults());
        ContentCache cache = new ContentCache(store, CLOCK, CacheSettings.defaults());
        AlertContentResolver alerts = new AlertContentResolver(cache, generator, eventBus, CLOCK);

        service.summarize(snapshot(52, 3, 12));
        ResolvedAlert alert = alerts.resolve(snapshot(52, 3, 12), AlertVariant.MORNING, null);

        assertEquals(ResolvedAlert.Origin.GENERATED, alert.origin());
        assertEquals(2, store.entries().size());
        assertEquals(ResolvedAlert.Origin.CACHE_EXACT, service.summarize(snapshot(52, 3, 12)).origin());
    }

    @Test
    void corruptCachedSummaryIsTreatedAsMiss() {
        ScriptedBackend backend = ScriptedBackend.replying(REPLY);
        ContentCache cache = new ContentCache(store, CLOCK, CacheSettings.defaults());
        cache.insert(cache.keyFor(snapshot(52, 3, 12), LocationSummaryService.VARIANT_ID), "not json");
        LocationSummaryService service = service(backend, CacheSettings.defaults());

        ResolvedSummary resolved = service.summarize(snapshot(52, 3, 12));

        assertEquals(ResolvedAlert.Origin.GENERATED, resolved.origin());
        assertEquals(1, backend.calls());
    }

    @Test
    void clearOldAndStatsWorkOnTheSummaryCache() {
        LocationSummaryService service = service(ScriptedBackend.replying(REPLY), CacheSettings.defaults());
        service.summarize(snapshot(52, 3, 12));

        assertEquals(1, service.stats(10).totalEntries());
        assertEquals(0, service.clearOld(1));
        assertFalse(store.entries().isEmpty());
    }

    private LocationSummaryService service(ScriptedBackend backend, CacheSettings settings) {
        eventBus.subscribe(AlertContentResolved.class, resolvedEvents::add);
        generator = new AlertGenerator(backend, GeneratorSettings.defaults());
        return new LocationSummaryService(new ContentCache(store, CLOCK, settings), generator, eventBus, CLOCK);
    }

    private static EnvironmentalSnapshot snapshot(int aqi, int pollen, int storm) {
        return new EnvironmentalSnapshot("loc-1", "Boston", aqi, pollen, storm, "airnow", CLOCK.instant());
    }
}
