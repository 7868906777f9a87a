package com.airbrief.content.api;

import com.airbrief.content.cache.CacheEntry;
import com.airbrief.content.cache.CachePrefix;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Keyed table of generated alert messages. Implementations may fail with unchecked exceptions;
 * the cache treats any failure as a miss.
 */
public interface ContentStore {
    Optional<CacheEntry> get(String cacheKey);

    /**
     * Entries sharing the prefix that are still valid at {@code validAt}, newest first.
     */
    List<CacheEntry> queryByPrefix(CachePrefix prefix, Instant validAt, int limit);

    /**
     * Insert or replace by {@link CacheEntry#cacheKey()}; last write wins.
     */
    void upsert(CacheEntry entry);

    void touch(String cacheKey, Instant accessedAt);

    /**
     * Removes entries whose cache date is strictly before {@code cutoff}.
     */
    int deleteOlderThan(LocalDate cutoff);

    int deleteExpired(Instant now);

    int count();

    List<CacheEntry> recent(int limit);
}
