package com.airbrief.content.summary;

import com.airbrief.content.cache.CacheStats;
import com.airbrief.content.cache.CachedAlert;
import com.airbrief.content.cache.ContentCache;
import com.airbrief.content.cache.MatchType;
import com.airbrief.content.generator.AlertGenerator;
import com.airbrief.content.generator.ResolvedAlert;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.AlertContentResolved;
import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Location-card summaries behind their own content cache. Entries are keyed like alerts with
 * the fixed variant segment {@value #VARIANT_ID}, so the summary cache keeps its own tolerance
 * and store. Fallback summaries are never cached.
 */
public final class LocationSummaryService {
    public static final String VARIANT_ID = "summary";
    public static final int MAX_TOKENS = 150;
    public static final int MAX_DESCRIPTION_CHARS = 200;

    private static final Logger LOGGER = Logger.getLogger(LocationSummaryService.class.getName());

    private final ContentCache cache;
    private final AlertGenerator generator;
    private final EventBus eventBus;
    private final Clock clock;

    public LocationSummaryService(ContentCache cache, AlertGenerator generator, EventBus eventBus, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.generator = Objects.requireNonNull(generator, "generator is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public ResolvedSummary summarize(EnvironmentalSnapshot snapshot) {
        ResolvedSummary resolved = cached(snapshot).orElseGet(() -> generate(snapshot));
        eventBus.publish(new AlertContentResolved(
                clock.instant(),
                snapshot.locationId(),
                VARIANT_ID,
                resolved.origin().name(),
                resolved.summary().headline().length() + resolved.summary().description().length()
        ));
        return resolved;
    }

    /**
     * Removes summaries dated more than {@code daysOld} days back.
     */
    public int clearOld(int daysOld) {
        return cache.sweep(daysOld);
    }

    public CacheStats stats(int recentLimit) {
        return cache.stats(recentLimit);
    }

    private Optional<ResolvedSummary> cached(EnvironmentalSnapshot snapshot) {
        Optional<CachedAlert> hit = cache.lookup(snapshot, VARIANT_ID);
        if (hit.isEmpty()) {
            return Optional.empty();
        }
        Optional<LocationSummary> summary = decode(hit.get());
        return summary.map(value -> new ResolvedSummary(
                value,
                hit.get().matchType() == MatchType.EXACT ? ResolvedAlert.Origin.CACHE_EXACT : ResolvedAlert.Origin.CACHE_FUZZY
        ));
    }

    private ResolvedSummary generate(EnvironmentalSnapshot snapshot) {
        LOGGER.info("Generating new summary for " + snapshot.locationName());
        Optional<LocationSummary> parsed = generator.complete(
                SummaryPrompts.SYSTEM_PROMPT,
                SummaryPrompts.userPrompt(snapshot, MAX_DESCRIPTION_CHARS),
                MAX_TOKENS,
                "summary at " + snapshot.locationId()
        ).flatMap(raw -> SummaryParser.parse(raw, MAX_DESCRIPTION_CHARS));
        if (parsed.isEmpty()) {
            LOGGER.warning("No usable summary for " + snapshot.locationId() + "; using fallback");
            return new ResolvedSummary(LocationSummary.FALLBACK, ResolvedAlert.Origin.FALLBACK);
        }
        try {
            cache.insert(cache.keyFor(snapshot, VARIANT_ID), JsonUtils.objectMapper().writeValueAsString(parsed.get()));
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "Could not encode summary for " + snapshot.locationId(), e);
        }
        return new ResolvedSummary(parsed.get(), ResolvedAlert.Origin.GENERATED);
    }

    private static Optional<LocationSummary> decode(CachedAlert hit) {
        try {
            return Optional.of(JsonUtils.objectMapper().readValue(hit.message(), LocationSummary.class));
        } catch (JsonProcessingException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Unreadable cached summary " + hit.cacheKey() + "; treating as miss", e);
            return Optional.empty();
        }
    }
}
