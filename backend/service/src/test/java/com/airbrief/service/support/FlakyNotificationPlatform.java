package com.airbrief.service.support;

import com.airbrief.service.notify.InMemoryNotificationPlatform;
import com.airbrief.service.notify.NotificationPayload;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory platform whose calls can be made to fail on demand.
 */
public class FlakyNotificationPlatform extends InMemoryNotificationPlatform {
    private final AtomicBoolean failSchedule = new AtomicBoolean();
    private final AtomicBoolean failCancel = new AtomicBoolean();
    private final AtomicInteger scheduleCalls = new AtomicInteger();

    public void failSchedule(boolean value) {
        failSchedule.set(value);
    }

    public void failCancel(boolean value) {
        failCancel.set(value);
    }

    public int scheduleCalls() {
        return scheduleCalls.get();
    }

    @Override
    public String scheduleDaily(int hour, int minute, NotificationPayload payload) {
        scheduleCalls.incrementAndGet();
        if (failSchedule.get()) {
            throw new IllegalStateException("platform unavailable");
        }
        return super.scheduleDaily(hour, minute, payload);
    }

    @Override
    public void cancel(String handle) {
        if (failCancel.get()) {
            throw new IllegalStateException("platform unavailable");
        }
        super.cancel(handle);
    }
}
