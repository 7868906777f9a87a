package com.airbrief.service.store;

import com.airbrief.content.api.ContentStore;
import com.airbrief.content.cache.CacheEntry;
import com.airbrief.content.cache.CachePrefix;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class JsonFileContentStore implements ContentStore {
    private static final Comparator<CacheEntry> NEWEST_FIRST = Comparator.comparing(CacheEntry::createdAt).reversed();

    private final JsonFileTable<CacheEntry> table;

    public JsonFileContentStore(Path file) {
        this.table = new JsonFileTable<>(file, CacheEntry.class, CacheEntry::cacheKey);
    }

    @Override
    public Optional<CacheEntry> get(String cacheKey) {
        return table.get(cacheKey);
    }

    @Override
    public List<CacheEntry> queryByPrefix(CachePrefix prefix, Instant validAt, int limit) {
        return table.select(entry -> prefix.matches(entry) && entry.isValidAt(validAt)).stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public void upsert(CacheEntry entry) {
        table.put(entry);
    }

    @Override
    public void touch(String cacheKey, Instant accessedAt) {
        table.update(cacheKey, entry -> entry.touched(accessedAt));
    }

    @Override
    public int deleteOlderThan(LocalDate cutoff) {
        return table.removeIf(entry -> entry.cacheDate().isBefore(cutoff));
    }

    @Override
    public int deleteExpired(Instant now) {
        return table.removeIf(entry -> !entry.isValidAt(now));
    }

    @Override
    public int count() {
        return table.size();
    }

    @Override
    public List<CacheEntry> recent(int limit) {
        return table.select(entry -> true).stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }
}
