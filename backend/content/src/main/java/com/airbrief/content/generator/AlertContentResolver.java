package com.airbrief.content.generator;

import com.airbrief.content.cache.CachedAlert;
import com.airbrief.content.cache.ContentCache;
import com.airbrief.content.cache.MatchType;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.AlertContentResolved;
import com.airbrief.core.model.AlertVariant;
import com.airbrief.core.model.EnvironmentalSnapshot;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Cache first, generator on miss, write-back of freshly generated text. Fallback text is
 * returned but never cached, so the next resolution retries the backend.
 */
public final class AlertContentResolver {
    private static final Logger LOGGER = Logger.getLogger(AlertContentResolver.class.getName());

    private final ContentCache cache;
    private final AlertGenerator generator;
    private final EventBus eventBus;
    private final Clock clock;

    public AlertContentResolver(ContentCache cache, AlertGenerator generator, EventBus eventBus, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.generator = Objects.requireNonNull(generator, "generator is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public ResolvedAlert resolve(EnvironmentalSnapshot snapshot, AlertVariant variant, String displayName) {
        ResolvedAlert resolved = cached(snapshot, variant).orElseGet(() -> generate(snapshot, variant, displayName));
        eventBus.publish(new AlertContentResolved(
                clock.instant(),
                snapshot.locationId(),
                variant.id(),
                resolved.origin().name(),
                resolved.message().length()
        ));
        return resolved;
    }

    private Optional<ResolvedAlert> cached(EnvironmentalSnapshot snapshot, AlertVariant variant) {
        Optional<CachedAlert> hit = cache.lookup(snapshot, variant);
        return hit.map(alert -> new ResolvedAlert(
                alert.message(),
                alert.matchType() == MatchType.EXACT ? ResolvedAlert.Origin.CACHE_EXACT : ResolvedAlert.Origin.CACHE_FUZZY
        ));
    }

    private ResolvedAlert generate(EnvironmentalSnapshot snapshot, AlertVariant variant, String displayName) {
        LOGGER.info("Generating new " + variant.id() + " alert for " + snapshot.locationName());
        GeneratedAlert generated = generator.generateDetailed(snapshot, variant, displayName);
        if (generated.fallback()) {
            return new ResolvedAlert(generated.message(), ResolvedAlert.Origin.FALLBACK);
        }
        cache.insert(cache.keyFor(snapshot, variant), generated.message());
        return new ResolvedAlert(generated.message(), ResolvedAlert.Origin.GENERATED);
    }
}
