package com.airbrief.service.notify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Process-local stand-in for the device scheduler. Handles carry a per-instance prefix so a
 * handle persisted by an earlier process never names a registration of this one.
 */
public class InMemoryNotificationPlatform implements NotificationPlatform {
    private static final Logger LOGGER = Logger.getLogger(InMemoryNotificationPlatform.class.getName());

    private final Map<String, ScheduledNotification> scheduled = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    @Override
    public String scheduleDaily(int hour, int minute, NotificationPayload payload) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Invalid daily trigger " + hour + ":" + minute);
        }
        String handle = nextHandle();
        scheduled.put(handle, new ScheduledNotification(handle, payload, hour, minute, true));
        LOGGER.fine(() -> "Registered daily " + handle + " at " + hour + ":" + minute);
        return handle;
    }

    @Override
    public String scheduleOnce(NotificationPayload payload) {
        String handle = nextHandle();
        scheduled.put(handle, new ScheduledNotification(handle, payload, null, null, false));
        return handle;
    }

    @Override
    public void cancel(String handle) {
        if (handle != null) {
            scheduled.remove(handle);
        }
    }

    @Override
    public List<ScheduledNotification> listScheduled() {
        return new ArrayList<>(scheduled.values());
    }

    private String nextHandle() {
        return "notification-" + instanceId + "-" + sequence.incrementAndGet();
    }
}
