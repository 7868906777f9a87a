package com.airbrief.service.store;

import com.airbrief.core.model.LocationRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileTableTest {
    @TempDir
    Path dir;

    @Test
    void rowsSurviveReload() {
        Path file = dir.resolve("nested/locations.json");
        JsonFileTable<LocationRecord> table = new JsonFileTable<>(file, LocationRecord.class, LocationRecord::id);
        table.put(new LocationRecord("boston", "Boston", "02108", 42.36, -71.06));
        table.put(new LocationRecord("seattle", "Seattle", "98101", 47.61, -122.33));

        JsonFileTable<LocationRecord> reloaded = new JsonFileTable<>(file, LocationRecord.class, LocationRecord::id);

        assertEquals(2, reloaded.size());
        assertEquals("02108", reloaded.get("boston").orElseThrow().zip());
        assertFalse(Files.exists(file.resolveSibling("locations.json.tmp")));
    }

    @Test
    void putReplacesByKey() {
        JsonFileTable<LocationRecord> table = new JsonFileTable<>(dir.resolve("t.json"), LocationRecord.class, LocationRecord::id);
        table.put(new LocationRecord("boston", "Boston", null, null, null));
        table.put(new LocationRecord("boston", "Boston, MA", null, null, null));

        assertEquals(1, table.size());
        assertEquals("Boston, MA", table.get("boston").orElseThrow().name());
    }

    @Test
    void removeIfAndUpdateReportWhatChanged() {
        JsonFileTable<LocationRecord> table = new JsonFileTable<>(dir.resolve("t.json"), LocationRecord.class, LocationRecord::id);
        table.put(new LocationRecord("a", "A", "00001", null, null));
        table.put(new LocationRecord("b", "B", null, null, null));
        table.put(new LocationRecord("c", "C", null, null, null));

        assertEquals(2, table.removeIf(row -> row.zip() == null));
        assertTrue(table.update("a", row -> new LocationRecord("a", "Renamed", row.zip(), null, null)).isPresent());
        assertTrue(table.update("missing", row -> row).isEmpty());
        assertTrue(table.remove("missing").isEmpty());
        assertEquals("Renamed", new JsonFileTable<>(dir.resolve("t.json"), LocationRecord.class, LocationRecord::id)
                .get("a").orElseThrow().name());
    }

    @Test
    void corruptFileFailsFastWithPath() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new JsonFileTable<>(file, LocationRecord.class, LocationRecord::id));
        assertTrue(error.getMessage().contains("broken.json"));
    }

    @Test
    void failedWriteRollsBackInMemoryRows() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "a file where a directory should be");
        JsonFileTable<LocationRecord> table = new JsonFileTable<>(
                blocker.resolve("table.json"),
                LocationRecord.class,
                LocationRecord::id
        );

        assertThrows(IllegalStateException.class, () -> table.put(new LocationRecord("boston", "Boston", null, null, null)));
        assertEquals(0, table.size());
    }
}
