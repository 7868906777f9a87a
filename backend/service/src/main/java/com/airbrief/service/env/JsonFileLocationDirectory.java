package com.airbrief.service.env;

import com.airbrief.content.api.LocationDirectory;
import com.airbrief.core.model.LocationRecord;
import com.airbrief.service.store.JsonFileTable;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Saved locations keyed by id, persisted alongside the other JSON stores.
 */
public final class JsonFileLocationDirectory implements LocationDirectory {
    private final JsonFileTable<LocationRecord> table;

    public JsonFileLocationDirectory(Path file) {
        this.table = new JsonFileTable<>(file, LocationRecord.class, LocationRecord::id);
    }

    @Override
    public Optional<LocationRecord> find(String locationId) {
        if (locationId == null) {
            return Optional.empty();
        }
        return table.get(locationId);
    }

    public void put(LocationRecord location) {
        table.put(location);
    }

    public boolean remove(String locationId) {
        return table.remove(locationId).isPresent();
    }

    public List<LocationRecord> all() {
        return table.select(location -> true);
    }
}
