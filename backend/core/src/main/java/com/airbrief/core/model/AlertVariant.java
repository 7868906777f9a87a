package com.airbrief.core.model;

import java.util.Objects;

/**
 * One kind of recurring alert at a location. Morning and evening reports are singletons per
 * location; custom alerts are told apart by the id of the user-defined alert.
 */
public record AlertVariant(AlertKind kind, String id) {
    public static final AlertVariant MORNING = new AlertVariant(AlertKind.MORNING, "morning");
    public static final AlertVariant EVENING = new AlertVariant(AlertKind.EVENING, "evening");

    private static final String CUSTOM_PREFIX = "custom-";

    public AlertVariant {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank() || id.contains("|")) {
            throw new IllegalArgumentException("Variant id must be non-blank and free of '|': " + id);
        }
    }

    public static AlertVariant custom(String customAlertId) {
        return new AlertVariant(AlertKind.CUSTOM, CUSTOM_PREFIX + customAlertId);
    }

    public static AlertVariant fromId(String id) {
        if (MORNING.id.equals(id)) {
            return MORNING;
        }
        if (EVENING.id.equals(id)) {
            return EVENING;
        }
        if (id != null && id.startsWith(CUSTOM_PREFIX) && id.length() > CUSTOM_PREFIX.length()) {
            return new AlertVariant(AlertKind.CUSTOM, id);
        }
        throw new IllegalArgumentException("Unknown alert variant: " + id);
    }
}
