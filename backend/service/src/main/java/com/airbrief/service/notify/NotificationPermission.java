package com.airbrief.service.notify;

@FunctionalInterface
public interface NotificationPermission {
    NotificationPermission GRANTED = () -> true;

    boolean granted();
}
