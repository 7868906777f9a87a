package com.airbrief.service.config;

import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String ALERTS_FILE = "alerts.json";

    private ConfigLoader() {
    }

    public static AlertServiceConfig loadAlerts(Path configDir) {
        return read(configDir.resolve(ALERTS_FILE), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
