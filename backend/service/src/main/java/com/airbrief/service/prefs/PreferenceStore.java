package com.airbrief.service.prefs;

import com.airbrief.service.store.JsonFileTable;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public class PreferenceStore {
    private final JsonFileTable<AlertPreferences> table;

    public PreferenceStore(Path file) {
        this.table = new JsonFileTable<>(file, AlertPreferences.class, AlertPreferences::locationId);
    }

    public Optional<AlertPreferences> get(String locationId) {
        return table.get(locationId);
    }

    public void put(AlertPreferences preferences) {
        table.put(preferences);
    }

    public boolean remove(String locationId) {
        return table.remove(locationId).isPresent();
    }

    public List<AlertPreferences> all() {
        return table.select(preferences -> true);
    }

    public Optional<AlertPreferences> ownerOfCustomAlert(String alertId) {
        return table.select(preferences -> preferences.customAlert(alertId).isPresent()).stream().findFirst();
    }
}
