package com.airbrief.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        assertTrue(first.writeValueAsString(new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"), null))
                .contains("\"name\":\"ok\""));
    }

    @Test
    void javaTimeValuesAreWrittenAsIsoStrings() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        Payload payload = new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"), LocalDate.parse("2026-02-01"));

        JsonNode tree = mapper.readTree(mapper.writeValueAsString(payload));
        assertEquals("2026-02-01T00:00:00Z", tree.get("createdAt").asText());
        assertEquals("2026-02-01", tree.get("cacheDate").asText());
        assertFalse(tree.has("optional"));

        Payload parsed = mapper.readValue(
                "{\"name\":\"ok\",\"createdAt\":\"2026-02-01T00:00:00Z\",\"cacheDate\":\"2026-02-01\",\"unknown\":1}",
                Payload.class
        );
        assertEquals(payload, parsed);
    }

    private record Payload(String name, String optional, Instant createdAt, LocalDate cacheDate) {
    }
}
