package com.airbrief.service.store;

import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JavaType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Small keyed table persisted as a JSON array. Every mutation rewrites the file through a
 * temporary sibling and an atomic move; if the write fails the in-memory rows are rolled back
 * and the failure is rethrown.
 */
public final class JsonFileTable<V> {
    private final Path file;
    private final JavaType listType;
    private final Function<V, String> keyOf;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, V> rows = new LinkedHashMap<>();

    public JsonFileTable(Path file, Class<V> rowType, Function<V, String> keyOf) {
        this.file = file;
        this.keyOf = keyOf;
        this.listType = JsonUtils.objectMapper().getTypeFactory().constructCollectionType(List.class, rowType);
        load();
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(rows.get(key));
        } finally {
            lock.unlock();
        }
    }

    public List<V> select(Predicate<V> filter) {
        lock.lock();
        try {
            List<V> selected = new ArrayList<>();
            for (V row : rows.values()) {
                if (filter.test(row)) {
                    selected.add(row);
                }
            }
            return selected;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return rows.size();
        } finally {
            lock.unlock();
        }
    }

    public void put(V row) {
        mutate(current -> {
            current.put(keyOf.apply(row), row);
            return 1;
        });
    }

    public Optional<V> remove(String key) {
        lock.lock();
        try {
            V existing = rows.get(key);
            if (existing == null) {
                return Optional.empty();
            }
            mutate(current -> {
                current.remove(key);
                return 1;
            });
            return Optional.of(existing);
        } finally {
            lock.unlock();
        }
    }

    public int removeIf(Predicate<V> filter) {
        return mutate(current -> {
            int before = current.size();
            current.values().removeIf(filter);
            return before - current.size();
        });
    }

    /**
     * Replaces the row under {@code key} when present. Returns the new row.
     */
    public Optional<V> update(String key, UnaryOperator<V> change) {
        lock.lock();
        try {
            V existing = rows.get(key);
            if (existing == null) {
                return Optional.empty();
            }
            V updated = change.apply(existing);
            mutate(current -> {
                current.put(key, updated);
                return 1;
            });
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    private int mutate(Function<Map<String, V>, Integer> change) {
        lock.lock();
        try {
            Map<String, V> before = new LinkedHashMap<>(rows);
            int affected = change.apply(rows);
            if (affected == 0) {
                return 0;
            }
            try {
                persist();
            } catch (RuntimeException e) {
                rows.clear();
                rows.putAll(before);
                throw e;
            }
            return affected;
        } finally {
            lock.unlock();
        }
    }

    private void load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                List<V> loaded = JsonUtils.objectMapper().readValue(in, listType);
                for (V row : loaded) {
                    rows.put(keyOf.apply(row), row);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading table from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            JsonUtils.prettyWriter().writeValue(tmp.toFile(), new ArrayList<>(rows.values()));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing table to " + file, e);
        }
    }
}
