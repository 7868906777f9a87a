package com.airbrief.service.notify;

import com.airbrief.service.store.JsonFileTable;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable map from schedule key to the handle the platform returned, so a restart can still
 * cancel what an earlier process registered.
 */
public class ScheduleRegistry {
    private final JsonFileTable<ScheduleRecord> table;

    public ScheduleRegistry(Path file) {
        this.table = new JsonFileTable<>(file, ScheduleRecord.class, record -> record.key().asString());
    }

    public Optional<ScheduleRecord> get(ScheduleKey key) {
        return table.get(key.asString());
    }

    public void put(ScheduleRecord record) {
        table.put(record);
    }

    public Optional<ScheduleRecord> remove(ScheduleKey key) {
        return table.remove(key.asString());
    }

    public List<ScheduleRecord> forLocation(String locationId) {
        return table.select(record -> record.locationId().equals(locationId)).stream()
                .sorted(Comparator.comparing(ScheduleRecord::variantId))
                .toList();
    }

    public List<ScheduleRecord> all() {
        return table.select(record -> true);
    }
}
