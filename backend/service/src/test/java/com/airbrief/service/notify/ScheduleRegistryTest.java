package com.airbrief.service.notify;

import com.airbrief.core.model.AlertVariant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleRegistryTest {
    private static final Instant T0 = Instant.parse("2026-03-02T11:00:00Z");

    @TempDir
    Path dir;

    @Test
    void recordsSurviveRestartSoHandlesCanStillBeCancelled() {
        Path file = dir.resolve("schedules.json");
        ScheduleRegistry registry = new ScheduleRegistry(file);
        registry.put(record("boston", "morning", "notification-7"));
        registry.put(record("boston", "custom-c1", "notification-8"));
        registry.put(record("seattle", "evening", "notification-9"));

        ScheduleRegistry reloaded = new ScheduleRegistry(file);

        List<ScheduleRecord> boston = reloaded.forLocation("boston");
        assertEquals(List.of("custom-c1", "morning"), boston.stream().map(ScheduleRecord::variantId).toList());
        ScheduleRecord morning = reloaded.get(new ScheduleKey("boston", "morning")).orElseThrow();
        assertEquals("notification-7", morning.handle());
        assertEquals(LocalTime.of(8, 0), morning.timeOfDay());
        assertEquals(AlertVariant.MORNING, morning.variant());
        assertEquals(AlertVariant.custom("c1"), boston.get(0).variant());
    }

    @Test
    void putReplacesAndRemoveReturnsRecord() {
        ScheduleRegistry registry = new ScheduleRegistry(dir.resolve("schedules.json"));
        registry.put(record("boston", "morning", "a"));
        registry.put(record("boston", "morning", "b"));

        assertEquals(1, registry.all().size());
        assertEquals("b", registry.remove(new ScheduleKey("boston", "morning")).orElseThrow().handle());
        assertTrue(registry.remove(new ScheduleKey("boston", "morning")).isEmpty());
    }

    private static ScheduleRecord record(String location, String variant, String handle) {
        return new ScheduleRecord(location, variant, "Morning Report", LocalTime.of(8, 0), handle,
                "title", "body", "GENERATED", T0);
    }
}
