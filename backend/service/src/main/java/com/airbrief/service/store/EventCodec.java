package com.airbrief.service.store;

import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.AlertContentResolved;
import com.airbrief.core.events.AlertRaised;
import com.airbrief.core.events.CacheSwept;
import com.airbrief.core.events.Event;
import com.airbrief.core.events.NotificationCancelled;
import com.airbrief.core.events.NotificationDelivered;
import com.airbrief.core.events.NotificationScheduled;
import com.airbrief.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One event per JSON line, wrapped with its type name so the line can be decoded back into
 * the right record.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "AlertContentResolved", AlertContentResolved.class,
            "NotificationScheduled", NotificationScheduled.class,
            "NotificationCancelled", NotificationCancelled.class,
            "NotificationDelivered", NotificationDelivered.class,
            "CacheSwept", CacheSwept.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES.values()) {
            subscribe(bus, type, consumer);
        }
    }

    private static <T extends Event> void subscribe(EventBus bus, Class<T> type, Consumer<Event> consumer) {
        bus.subscribe(type, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
