package com.airbrief.content.cache;

import com.airbrief.content.api.ContentStore;
import com.airbrief.core.model.AlertVariant;
import com.airbrief.core.model.EnvironmentalSnapshot;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Time-boxed cache of generated alert messages in front of a {@link ContentStore}.
 * <p>
 * Lookups try the exact quantized key first, then the closest recent entry for the same
 * location, variant, source and day. The cache is an optimization only: store failures are
 * logged and reported as misses on read and as no-ops on write.
 */
public final class ContentCache {
    private static final Logger LOGGER = Logger.getLogger(ContentCache.class.getName());

    private final ContentStore store;
    private final CacheKeyBuilder keyBuilder;
    private final FuzzyMatcher fuzzyMatcher;
    private final CacheSettings settings;
    private final Clock clock;

    public ContentCache(ContentStore store, Clock clock, CacheSettings settings) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.keyBuilder = new CacheKeyBuilder(clock);
        this.fuzzyMatcher = new FuzzyMatcher(settings.fuzzyTolerance());
    }

    public CacheKey keyFor(EnvironmentalSnapshot snapshot, AlertVariant variant) {
        return keyBuilder.build(snapshot, variant);
    }

    public CacheKey keyFor(EnvironmentalSnapshot snapshot, String variantId) {
        return keyBuilder.build(snapshot, variantId);
    }

    public Optional<CachedAlert> lookup(EnvironmentalSnapshot snapshot, AlertVariant variant) {
        return lookup(snapshot, variant.id());
    }

    public Optional<CachedAlert> lookup(EnvironmentalSnapshot snapshot, String variantId) {
        CacheKey key = keyFor(snapshot, variantId);
        String serialized = key.serialize();
        Instant now = clock.instant();
        try {
            Optional<CacheEntry> exact = store.get(serialized).filter(entry -> entry.isValidAt(now));
            if (exact.isPresent()) {
                touchQuietly(serialized, now);
                LOGGER.fine(() -> "Exact cache hit for " + serialized);
                CacheEntry entry = exact.get();
                return Optional.of(new CachedAlert(entry.message(), MatchType.EXACT, 0, serialized, entry.createdAt()));
            }

            List<CacheEntry> candidates = store.queryByPrefix(key.prefix(), now, settings.candidateLimit());
            Optional<FuzzyMatcher.Match> closest = fuzzyMatcher.closest(
                    key.bucket(),
                    candidates.stream().filter(entry -> entry.isValidAt(now)).toList()
            );
            if (closest.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry entry = closest.get().entry();
            touchQuietly(entry.cacheKey(), now);
            LOGGER.fine(() -> "Fuzzy cache hit for " + serialized + " via " + entry.cacheKey()
                    + " (distance " + closest.get().distance() + ")");
            return Optional.of(new CachedAlert(
                    entry.message(),
                    MatchType.FUZZY,
                    closest.get().distance(),
                    entry.cacheKey(),
                    entry.createdAt()
            ));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache lookup failed for " + serialized + "; treating as miss", e);
            return Optional.empty();
        }
    }

    /**
     * @return {@code true} when the entry reached the store
     */
    public boolean insert(CacheKey key, String message) {
        try {
            store.upsert(CacheEntry.create(key, message, clock.instant(), settings.expiryHorizon()));
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache insert failed for " + key.serialize(), e);
            return false;
        }
    }

    /**
     * Deletes entries dated before {@code today - maxAgeDays} together with anything already
     * past its expiry.
     *
     * @return number of entries removed
     */
    public int sweep(int maxAgeDays) {
        if (maxAgeDays < 0) {
            throw new IllegalArgumentException("maxAgeDays must be >= 0");
        }
        LocalDate cutoff = keyBuilder.today().minusDays(maxAgeDays);
        try {
            int removed = store.deleteOlderThan(cutoff) + store.deleteExpired(clock.instant());
            LOGGER.info("Swept " + removed + " cached alerts older than " + cutoff);
            return removed;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache sweep failed", e);
            return 0;
        }
    }

    public LocalDate sweepCutoff(int maxAgeDays) {
        return keyBuilder.today().minusDays(maxAgeDays);
    }

    public CacheStats stats(int recentLimit) {
        try {
            return new CacheStats(store.count(), store.recent(recentLimit));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache stats unavailable", e);
            return CacheStats.empty();
        }
    }

    private void touchQuietly(String cacheKey, Instant now) {
        try {
            store.touch(cacheKey, now);
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Access tracking update failed for " + cacheKey, e);
        }
    }
}
