package com.airbrief.service.store;

import com.airbrief.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    /**
     * @return matching events in append order, at most the last {@code limit} of them
     */
    List<Event> query(Instant since, Optional<String> type, int limit);

    /**
     * Notification and content history of one location, oldest first. Raised alerts count
     * when their details name the location.
     */
    List<Event> forLocation(String locationId, int limit);
}
