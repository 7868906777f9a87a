package com.airbrief.service.notify;

import com.airbrief.content.api.LocationDirectory;
import com.airbrief.content.api.SnapshotProvider;
import com.airbrief.content.generator.AlertContentResolver;
import com.airbrief.content.generator.FallbackMessages;
import com.airbrief.content.generator.ResolvedAlert;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.NotificationCancelled;
import com.airbrief.core.events.NotificationDelivered;
import com.airbrief.core.events.NotificationScheduled;
import com.airbrief.core.model.AlertKind;
import com.airbrief.core.model.AlertVariant;
import com.airbrief.core.model.EnvironmentalSnapshot;
import com.airbrief.core.model.LocationRecord;
import com.airbrief.core.util.TimeOfDay;
import com.airbrief.service.prefs.AlertPlan;
import com.airbrief.service.prefs.AlertPreferences;

import java.time.Clock;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Owns the platform registrations for every (location, variant) pair.
 * <p>
 * Content is resolved before the trigger is registered, so the body is fixed at schedule
 * time. Any earlier registration for the same pair is cancelled first; after every operation
 * at most one handle per pair is live. Operations on one pair are serialized, location-wide
 * operations additionally hold the location lock.
 */
public class NotificationLifecycleManager {
    public static final String SENTINEL_SOURCE_ID = "unavailable";

    private static final Logger LOGGER = Logger.getLogger(NotificationLifecycleManager.class.getName());

    private final NotificationPlatform platform;
    private final NotificationPermission permission;
    private final LocationDirectory locations;
    private final SnapshotProvider snapshots;
    private final AlertContentResolver resolver;
    private final ScheduleRegistry registry;
    private final EventBus eventBus;
    private final Clock clock;
    private final KeyedLocks<String> locationLocks = new KeyedLocks<>();
    private final KeyedLocks<ScheduleKey> keyLocks = new KeyedLocks<>();

    public NotificationLifecycleManager(
            NotificationPlatform platform,
            NotificationPermission permission,
            LocationDirectory locations,
            SnapshotProvider snapshots,
            AlertContentResolver resolver,
            ScheduleRegistry registry,
            EventBus eventBus,
            Clock clock
    ) {
        this.platform = Objects.requireNonNull(platform, "platform is required");
        this.permission = Objects.requireNonNull(permission, "permission is required");
        this.locations = Objects.requireNonNull(locations, "locations is required");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * @param timeOfDay strict 24-hour {@code HH:MM}
     * @return the platform handle, or {@code null} when nothing was scheduled
     */
    public String schedule(String locationId, AlertVariant variant, String displayName, String timeOfDay) {
        if (!permissionGranted()) {
            return null;
        }
        Optional<LocalTime> time = TimeOfDay.parse(timeOfDay);
        if (time.isEmpty()) {
            LOGGER.warning("Not scheduling " + locationId + "|" + variant.id() + ": invalid time '" + timeOfDay + "'");
            return null;
        }
        ScheduleKey key = new ScheduleKey(locationId, variant.id());
        return keyLocks.withLock(key, () -> scheduleLocked(key, variant, displayName, time.get()));
    }

    /**
     * @return {@code true} when a live schedule was removed
     */
    public boolean cancel(String locationId, AlertVariant variant) {
        ScheduleKey key = new ScheduleKey(locationId, variant.id());
        return keyLocks.withLock(key, () -> registry.get(key).isPresent() && clearExisting(key));
    }

    /**
     * Cancels every schedule of the location, including platform registrations whose record
     * was lost.
     *
     * @return number of registrations cancelled
     */
    public int cancelLocation(String locationId) {
        int cancelled = locationLocks.withLock(locationId, () -> cancelAllLocked(locationId));
        LOGGER.info("Cancelled " + cancelled + " schedules for " + locationId);
        return cancelled;
    }

    /**
     * Brings the platform in line with the stored preferences: everything for the location is
     * cancelled, then each enabled alert is scheduled once. Running it again with the same
     * preferences yields the same set of schedules.
     *
     * @param preferences {@code null} means no alerts are wanted
     * @return handles of the new schedules by variant id
     */
    public Map<String, String> reconcile(String locationId, AlertPreferences preferences) {
        if (preferences != null && !locationId.equals(preferences.locationId())) {
            throw new IllegalArgumentException(
                    "Preferences for " + preferences.locationId() + " cannot reconcile " + locationId);
        }
        return locationLocks.withLock(locationId, () -> {
            cancelAllLocked(locationId);
            Map<String, String> handles = new LinkedHashMap<>();
            if (preferences == null || !permissionGranted()) {
                return handles;
            }
            for (AlertPlan plan : preferences.enabledPlans()) {
                ScheduleKey key = new ScheduleKey(locationId, plan.variant().id());
                String handle = keyLocks.withLock(key,
                        () -> scheduleLocked(key, plan.variant(), plan.displayName(), plan.time()));
                if (handle != null) {
                    handles.put(plan.variant().id(), handle);
                }
            }
            LOGGER.info("Reconciled " + locationId + ": " + handles.size() + " of "
                    + preferences.enabledPlans().size() + " enabled alerts scheduled");
            return handles;
        });
    }

    /**
     * Re-resolves content for an existing schedule and re-registers it at the same time.
     *
     * @return the new handle, or {@code null} when there was nothing to refresh or it failed
     */
    public String refresh(String locationId, String variantId) {
        ScheduleKey key = new ScheduleKey(locationId, variantId);
        return keyLocks.withLock(key, () -> {
            Optional<ScheduleRecord> existing = registry.get(key);
            if (existing.isEmpty()) {
                LOGGER.fine(() -> "Nothing to refresh for " + key.asString());
                return null;
            }
            if (!permissionGranted()) {
                return null;
            }
            ScheduleRecord record = existing.get();
            return scheduleLocked(key, record.variant(), record.displayName(), record.timeOfDay());
        });
    }

    /**
     * Delivery never regenerates content; it only tells listeners which location to open.
     */
    public Optional<ScheduleRecord> handleDelivery(DeliveredNotification delivered) {
        String locationId = delivered.data().get(NotificationPayload.DATA_LOCATION_ID);
        String variantId = delivered.data().get(NotificationPayload.DATA_VARIANT_ID);
        Optional<ScheduleRecord> record;
        if (locationId != null && variantId != null) {
            record = registry.get(new ScheduleKey(locationId, variantId));
        } else {
            record = registry.all().stream()
                    .filter(candidate -> candidate.handle().equals(delivered.handle()))
                    .findFirst();
        }
        String resolvedLocation = record.map(ScheduleRecord::locationId).orElse(locationId);
        String resolvedVariant = record.map(ScheduleRecord::variantId).orElse(variantId);
        if (resolvedLocation == null) {
            LOGGER.warning("Delivered notification " + delivered.handle() + " carries no location");
            return Optional.empty();
        }
        eventBus.publish(new NotificationDelivered(clock.instant(), resolvedLocation, resolvedVariant, delivered.handle()));
        return record;
    }

    /**
     * Shows a one-off notification with static test text.
     *
     * @return the platform handle, or {@code null} when permission is missing or the location is unknown
     */
    public String sendTest(String locationId, AlertKind kind) {
        if (!permissionGranted()) {
            return null;
        }
        Optional<LocationRecord> location = findLocation(locationId);
        if (location.isEmpty()) {
            LOGGER.warning("Not sending test notification: unknown location " + locationId);
            return null;
        }
        NotificationPayload payload = new NotificationPayload(
                kind.icon() + " Test " + kind.defaultName() + " - " + location.get().displayName(),
                FallbackMessages.testFor(kind),
                Map.of(
                        NotificationPayload.DATA_TYPE, payloadType(kind) + "-test",
                        NotificationPayload.DATA_LOCATION_ID, locationId
                )
        );
        try {
            return platform.scheduleOnce(payload);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Test notification for " + locationId + " was rejected", e);
            return null;
        }
    }

    /**
     * Drops records whose handle the platform no longer lists, as after a restart against a
     * fresh platform. Run before reconciling so stale handles are never cancelled.
     *
     * @return number of records dropped
     */
    public int forgetUnregistered() {
        int dropped = 0;
        for (ScheduleRecord record : registry.all()) {
            ScheduleKey key = record.key();
            boolean removed = keyLocks.withLock(key, () -> {
                Optional<ScheduleRecord> current = registry.get(key);
                if (current.isEmpty() || stillRegistered(current.get().handle())) {
                    return false;
                }
                registry.remove(key);
                eventBus.publish(new NotificationCancelled(clock.instant(), key.locationId(), key.variantId(), current.get().handle()));
                return true;
            });
            if (removed) {
                dropped++;
            }
        }
        if (dropped > 0) {
            LOGGER.info("Forgot " + dropped + " schedule records unknown to the platform");
        }
        return dropped;
    }

    public List<ScheduleRecord> activeSchedules(String locationId) {
        return registry.forLocation(locationId);
    }

    private String scheduleLocked(ScheduleKey key, AlertVariant variant, String displayName, LocalTime time) {
        Optional<LocationRecord> location = findLocation(key.locationId());
        if (location.isEmpty()) {
            LOGGER.warning("Not scheduling " + key.asString() + ": unknown location");
            return null;
        }
        String name = displayName == null || displayName.isBlank() ? variant.kind().defaultName() : displayName.trim();
        ResolvedAlert content = resolveContent(fetchSnapshot(location.get()), variant, name);

        if (!clearExisting(key)) {
            return null;
        }
        NotificationPayload payload = new NotificationPayload(
                variant.kind().icon() + " " + name + " - " + location.get().displayName(),
                content.message(),
                Map.of(
                        NotificationPayload.DATA_TYPE, payloadType(variant.kind()),
                        NotificationPayload.DATA_LOCATION_ID, key.locationId(),
                        NotificationPayload.DATA_VARIANT_ID, key.variantId()
                )
        );
        String handle;
        try {
            handle = platform.scheduleDaily(time.getHour(), time.getMinute(), payload);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Platform rejected schedule for " + key.asString(), e);
            return null;
        }
        ScheduleRecord record = new ScheduleRecord(
                key.locationId(),
                key.variantId(),
                name,
                time,
                handle,
                payload.title(),
                payload.body(),
                content.origin().name(),
                clock.instant()
        );
        try {
            registry.put(record);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not record " + handle + " for " + key.asString() + "; withdrawing it", e);
            cancelQuietly(handle);
            return null;
        }
        eventBus.publish(new NotificationScheduled(
                clock.instant(),
                key.locationId(),
                key.variantId(),
                handle,
                time.getHour(),
                time.getMinute(),
                true
        ));
        LOGGER.info("Scheduled " + key.asString() + " daily at " + TimeOfDay.format(time)
                + " as " + handle + " (" + content.origin() + ")");
        return handle;
    }

    /**
     * @return {@code false} when the previous registration may still be live
     */
    private boolean clearExisting(ScheduleKey key) {
        Optional<ScheduleRecord> existing = registry.get(key);
        if (existing.isEmpty()) {
            return true;
        }
        String handle = existing.get().handle();
        try {
            platform.cancel(handle);
        } catch (RuntimeException e) {
            if (stillRegistered(handle)) {
                LOGGER.log(Level.WARNING, "Could not cancel " + handle + " for " + key.asString(), e);
                return false;
            }
            LOGGER.log(Level.FINE, "Cancel of " + handle + " failed but it is no longer registered", e);
        }
        try {
            registry.remove(key);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cancelled " + handle + " but could not drop its record", e);
            return false;
        }
        eventBus.publish(new NotificationCancelled(clock.instant(), key.locationId(), key.variantId(), handle));
        LOGGER.info("Cancelled " + key.asString() + " (" + handle + ")");
        return true;
    }

    private int cancelAllLocked(String locationId) {
        int cancelled = 0;
        for (ScheduleRecord record : registry.forLocation(locationId)) {
            ScheduleKey key = record.key();
            if (keyLocks.withLock(key, () -> registry.get(key).isPresent() && clearExisting(key))) {
                cancelled++;
            }
        }
        return cancelled + cancelOrphans(locationId);
    }

    private int cancelOrphans(String locationId) {
        List<ScheduledNotification> orphans;
        try {
            Set<String> known = registry.all().stream().map(ScheduleRecord::handle).collect(Collectors.toSet());
            orphans = platform.listScheduled().stream()
                    .filter(ScheduledNotification::repeats)
                    .filter(notification -> locationId.equals(notification.payload().locationId()))
                    .filter(notification -> !known.contains(notification.handle()))
                    .toList();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not list platform schedules for " + locationId, e);
            return 0;
        }
        int cancelled = 0;
        for (ScheduledNotification orphan : orphans) {
            String variantId = orphan.payload().data().get(NotificationPayload.DATA_VARIANT_ID);
            if (variantId == null) {
                cancelQuietly(orphan.handle());
                cancelled++;
                continue;
            }
            ScheduleKey key = new ScheduleKey(locationId, variantId);
            boolean removed = keyLocks.withLock(key, () -> {
                boolean adopted = registry.get(key)
                        .map(record -> record.handle().equals(orphan.handle()))
                        .orElse(false);
                if (adopted) {
                    return false;
                }
                cancelQuietly(orphan.handle());
                return true;
            });
            if (removed) {
                LOGGER.info("Cancelled unrecorded registration " + orphan.handle() + " for " + key.asString());
                cancelled++;
            }
        }
        return cancelled;
    }

    private boolean stillRegistered(String handle) {
        try {
            return platform.listScheduled().stream().anyMatch(notification -> notification.handle().equals(handle));
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Could not list platform schedules", e);
            return true;
        }
    }

    private void cancelQuietly(String handle) {
        try {
            platform.cancel(handle);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not cancel " + handle, e);
        }
    }

    private boolean permissionGranted() {
        boolean granted;
        try {
            granted = permission.granted();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Notification permission check failed", e);
            granted = false;
        }
        if (!granted) {
            LOGGER.warning("Notification permission not granted; nothing scheduled");
        }
        return granted;
    }

    private Optional<LocationRecord> findLocation(String locationId) {
        try {
            return locations.find(locationId);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Location lookup failed for " + locationId, e);
            return Optional.empty();
        }
    }

    private EnvironmentalSnapshot fetchSnapshot(LocationRecord location) {
        try {
            return snapshots.fetchSnapshot(location);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Snapshot unavailable for " + location.id() + "; using unknown readings", e);
            return EnvironmentalSnapshot.unavailable(location.id(), location.displayName(), SENTINEL_SOURCE_ID, clock.instant());
        }
    }

    private ResolvedAlert resolveContent(EnvironmentalSnapshot snapshot, AlertVariant variant, String name) {
        try {
            ResolvedAlert resolved = resolver.resolve(snapshot, variant, name);
            if (resolved.message() != null && !resolved.message().isBlank()) {
                return resolved;
            }
            LOGGER.warning("Resolved empty content for " + snapshot.locationId() + "|" + variant.id());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Content resolution failed for " + snapshot.locationId() + "|" + variant.id(), e);
        }
        return new ResolvedAlert(FallbackMessages.forKind(variant.kind()), ResolvedAlert.Origin.FALLBACK);
    }

    private static String payloadType(AlertKind kind) {
        return switch (kind) {
            case MORNING -> "morning-report";
            case EVENING -> "evening-report";
            case CUSTOM -> "custom-alert";
        };
    }
}
