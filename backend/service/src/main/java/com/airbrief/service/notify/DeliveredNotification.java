package com.airbrief.service.notify;

import java.util.Map;

/**
 * Reported by the host when a scheduled notification is shown or tapped.
 */
public record DeliveredNotification(String handle, Map<String, String> data) {
    public DeliveredNotification {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
