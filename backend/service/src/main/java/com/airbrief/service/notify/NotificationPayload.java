package com.airbrief.service.notify;

import java.util.Map;
import java.util.Objects;

/**
 * What the device shows when the trigger fires. The body is rendered before scheduling;
 * nothing is evaluated at fire time.
 */
public record NotificationPayload(String title, String body, Map<String, String> data) {
    public static final String DATA_TYPE = "type";
    public static final String DATA_LOCATION_ID = "locationId";
    public static final String DATA_VARIANT_ID = "variantId";

    public NotificationPayload {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(body, "body is required");
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public String locationId() {
        return data.get(DATA_LOCATION_ID);
    }
}
