package com.airbrief.core.events;

/**
 * An event that belongs to one saved location.
 */
public interface LocationEvent extends Event {
    String locationId();
}
