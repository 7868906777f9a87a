package com.airbrief.core.util;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeOfDayTest {
    @Test
    void parsesStrictTwentyFourHourTimes() {
        assertEquals(LocalTime.of(8, 0), TimeOfDay.parse("08:00").orElseThrow());
        assertEquals(LocalTime.of(23, 59), TimeOfDay.parse(" 23:59 ").orElseThrow());
        assertEquals(LocalTime.MIDNIGHT, TimeOfDay.parse("00:00").orElseThrow());
    }

    @Test
    void rejectsEverythingElse() {
        for (String value : List.of("8:00", "24:00", "12:60", "1200", "12:00:00", "noon", "")) {
            assertTrue(TimeOfDay.parse(value).isEmpty(), value);
        }
        assertTrue(TimeOfDay.parse(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> TimeOfDay.parseOrThrow("7pm"));
    }

    @Test
    void formatsWithLeadingZeros() {
        assertEquals("07:05", TimeOfDay.format(LocalTime.of(7, 5, 30)));
    }
}
