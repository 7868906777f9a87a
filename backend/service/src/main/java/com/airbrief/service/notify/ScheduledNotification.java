package com.airbrief.service.notify;

/**
 * A notification registered with the platform. {@code hour} and {@code minute} are null for
 * one-off notifications.
 */
public record ScheduledNotification(
        String handle,
        NotificationPayload payload,
        Integer hour,
        Integer minute,
        boolean repeats
) {
}
