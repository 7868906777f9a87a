package com.airbrief.service.store;

import com.airbrief.core.events.AlertRaised;
import com.airbrief.core.events.Event;
import com.airbrief.core.events.LocationEvent;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Append-only audit log of lifecycle and cache events, one JSON object per line.
 * <p>
 * A final line without its newline is what an interrupted append leaves behind; it is
 * skipped with a warning. Any other undecodable line fails the read.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        return lastMatching(
                event -> !event.timestamp().isBefore(since) && type.map(event.type()::equals).orElse(true),
                limit
        );
    }

    @Override
    public List<Event> forLocation(String locationId, int limit) {
        return lastMatching(event -> locationId.equals(locationOf(event)), limit);
    }

    static String locationOf(Event event) {
        if (event instanceof LocationEvent locationEvent) {
            return locationEvent.locationId();
        }
        if (event instanceof AlertRaised alert && alert.details() != null) {
            Object locationId = alert.details().get("locationId");
            return locationId == null ? null : locationId.toString();
        }
        return null;
    }

    private List<Event> lastMatching(Predicate<Event> filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            String content = Files.readString(file, StandardCharsets.UTF_8);
            boolean tornTail = !content.isEmpty() && !content.endsWith("\n");
            String[] lines = content.split("\n", -1);
            List<Event> events = new ArrayList<>();
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i].strip();
                if (line.isEmpty()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    if (tornTail && i == lines.length - 1) {
                        LOGGER.warning("Skipping incomplete last event line " + (i + 1) + " of " + file);
                        break;
                    }
                    throw new IllegalStateException("Invalid event at line " + (i + 1) + " of " + file, decodeError);
                }
                if (filter.test(event)) {
                    events.add(event);
                }
            }
            if (events.size() <= limit) {
                return events;
            }
            return List.copyOf(events.subList(events.size() - limit, events.size()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
