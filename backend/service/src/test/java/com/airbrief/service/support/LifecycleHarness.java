package com.airbrief.service.support;

import com.airbrief.content.api.SnapshotProvider;
import com.airbrief.content.cache.CacheSettings;
import com.airbrief.content.cache.ContentCache;
import com.airbrief.content.generator.AlertContentResolver;
import com.airbrief.content.generator.AlertGenerator;
import com.airbrief.content.generator.GeneratorSettings;
import com.airbrief.content.summary.LocationSummaryService;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.Event;
import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.model.LocationRecord;
import com.airbrief.service.notify.NotificationLifecycleManager;
import com.airbrief.service.notify.ScheduleRegistry;
import com.airbrief.service.store.EventCodec;
import com.airbrief.service.store.JsonFileContentStore;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle manager wired to file stores under a temp directory, an in-memory platform and a
 * scripted generation backend.
 */
public class LifecycleHarness implements AutoCloseable {
    public static final ZoneId ZONE = ZoneId.of("America/New_York");

    public final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T11:00:00Z"), ZONE);
    public final EventBus eventBus = new EventBus();
    public final List<Event> events = new CopyOnWriteArrayList<>();
    public final FlakyNotificationPlatform platform = new FlakyNotificationPlatform();
    public final AtomicBoolean permission = new AtomicBoolean(true);
    public final Map<String, LocationRecord> locations = new ConcurrentHashMap<>();
    public final AtomicReference<SnapshotProvider> snapshots = new AtomicReference<SnapshotProvider>(this::defaultSnapshot);
    public final ScriptedBackend backend;
    public final ContentCache cache;
    public final ContentCache summaryCache;
    public final LocationSummaryService summaries;
    public final ScheduleRegistry registry;
    public final AlertContentResolver resolver;
    public final NotificationLifecycleManager manager;
    private final AlertGenerator generator;

    public LifecycleHarness(Path dir, ScriptedBackend backend) {
        this.backend = backend;
        EventCodec.subscribeAll(eventBus, events::add);
        this.cache = new ContentCache(new JsonFileContentStore(dir.resolve("content-cache.json")), clock, CacheSettings.defaults());
        this.generator = new AlertGenerator(backend, new GeneratorSettings(178, 60, Duration.ofSeconds(2), 2));
        this.registry = new ScheduleRegistry(dir.resolve("schedules.json"));
        this.resolver = new AlertContentResolver(cache, generator, eventBus, clock);
        this.summaryCache = new ContentCache(new JsonFileContentStore(dir.resolve("summary-cache.json")), clock, CacheSettings.defaults());
        this.summaries = new LocationSummaryService(summaryCache, generator, eventBus, clock);
        this.manager = newManager();
        locations.put("boston", new LocationRecord("boston", "Boston", "02108", 42.36, -71.06));
        locations.put("seattle", new LocationRecord("seattle", "Seattle", "98101", 47.61, -122.33));
    }

    /**
     * Builds a manager over the same collaborators; tests subclass it to inject failures.
     */
    public NotificationLifecycleManager newManager() {
        return new NotificationLifecycleManager(
                platform,
                permission::get,
                locationId -> Optional.ofNullable(locations.get(locationId)),
                location -> snapshots.get().fetchSnapshot(location),
                resolver,
                registry,
                eventBus,
                clock
        );
    }

    public <T extends Event> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private EnvironmentalSnapshot defaultSnapshot(LocationRecord location) {
        return new EnvironmentalSnapshot(location.id(), location.displayName(), 52, 3, 12, "airnow", clock.instant());
    }

    @Override
    public void close() {
        generator.close();
    }
}
