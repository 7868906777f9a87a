package com.airbrief.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void missingKeysWarnAndUserAgentDefaults() {
        List<String> warnings = new ArrayList<>();

        Main.Secrets secrets = Main.resolveSecrets(Map.of(), warnings::add);

        assertEquals("", secrets.openAiApiKey());
        assertEquals("", secrets.airNowApiKey());
        assertTrue(secrets.noaaUserAgent().startsWith("airbrief-alerts/"));
        assertEquals(2, warnings.size());
    }

    @Test
    void providedValuesAreTrimmedAndUsed() {
        List<String> warnings = new ArrayList<>();

        Main.Secrets secrets = Main.resolveSecrets(Map.of(
                "OPENAI_API_KEY", " sk-live ",
                "AIRNOW_API_KEY", "air",
                "NOAA_USER_AGENT", "me (me@example.com)"
        ), warnings::add);

        assertEquals("sk-live", secrets.openAiApiKey());
        assertEquals("air", secrets.airNowApiKey());
        assertEquals("me (me@example.com)", secrets.noaaUserAgent());
        assertTrue(warnings.isEmpty());
    }
}
