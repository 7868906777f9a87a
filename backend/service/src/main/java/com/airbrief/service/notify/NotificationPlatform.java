package com.airbrief.service.notify;

import java.util.List;

/**
 * Host notification scheduler. Handles are opaque and unique per registration.
 */
public interface NotificationPlatform {
    String scheduleDaily(int hour, int minute, NotificationPayload payload);

    String scheduleOnce(NotificationPayload payload);

    /**
     * Unknown handles are ignored.
     */
    void cancel(String handle);

    List<ScheduledNotification> listScheduled();
}
