package com.airbrief.service.prefs;

import com.airbrief.core.model.AlertKind;
import com.airbrief.core.util.TimeOfDay;
import com.airbrief.service.notify.KeyedLocks;
import com.airbrief.service.notify.NotificationLifecycleManager;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Preference mutations for the host app. Each change is persisted first and then pushed to
 * the lifecycle manager; a failed reconcile is logged and left for the next change or
 * restart, since the stored preferences are already correct.
 */
public class AlertPreferencesService {
    private static final Logger LOGGER = Logger.getLogger(AlertPreferencesService.class.getName());

    private final PreferenceStore store;
    private final NotificationLifecycleManager lifecycle;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final KeyedLocks<String> locks = new KeyedLocks<>();

    public AlertPreferencesService(PreferenceStore store, NotificationLifecycleManager lifecycle, Clock clock) {
        this(store, lifecycle, clock, () -> UUID.randomUUID().toString());
    }

    public AlertPreferencesService(
            PreferenceStore store,
            NotificationLifecycleManager lifecycle,
            Clock clock,
            Supplier<String> idGenerator
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator is required");
    }

    public Optional<AlertPreferences> get(String locationId) {
        return store.get(locationId);
    }

    /**
     * Stores the default preferences (every alert off) unless the location already has some.
     */
    public AlertPreferences createDefaults(String locationId) {
        return locks.withLock(locationId, () -> {
            Optional<AlertPreferences> existing = store.get(locationId);
            if (existing.isPresent()) {
                return existing.get();
            }
            AlertPreferences defaults = AlertPreferences.defaults(locationId, clock.instant());
            store.put(defaults);
            reconcileQuietly(defaults);
            return defaults;
        });
    }

    /**
     * Merges the patch into the stored preferences, or into the defaults when the location has
     * none yet.
     */
    public AlertPreferences update(String locationId, AlertPreferencesPatch patch) {
        return locks.withLock(locationId, () -> {
            AlertPreferences base = store.get(locationId)
                    .orElseGet(() -> AlertPreferences.defaults(locationId, clock.instant()));
            AlertPreferences updated = patch.applyTo(base, clock.instant());
            store.put(updated);
            reconcileQuietly(updated);
            return updated;
        });
    }

    /**
     * New custom alerts start enabled.
     */
    public CustomAlert addCustomAlert(String locationId, String name, String time) {
        CustomAlert alert = new CustomAlert(
                idGenerator.get(),
                name == null || name.isBlank() ? AlertKind.CUSTOM.defaultName() : name.trim(),
                TimeOfDay.parseOrThrow(time),
                true
        );
        locks.withLock(locationId, () -> {
            AlertPreferences base = store.get(locationId)
                    .orElseGet(() -> AlertPreferences.defaults(locationId, clock.instant()));
            List<CustomAlert> alerts = new ArrayList<>(base.customAlerts());
            alerts.add(alert);
            AlertPreferences updated = base.withCustomAlerts(alerts, clock.instant());
            store.put(updated);
            reconcileQuietly(updated);
            return updated;
        });
        return alert;
    }

    public Optional<CustomAlert> updateCustomAlert(String alertId, CustomAlertPatch patch) {
        Optional<AlertPreferences> owner = store.ownerOfCustomAlert(alertId);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        String locationId = owner.get().locationId();
        return locks.withLock(locationId, () -> {
            Optional<AlertPreferences> current = store.get(locationId);
            Optional<CustomAlert> existing = current.flatMap(preferences -> preferences.customAlert(alertId));
            if (existing.isEmpty()) {
                return Optional.empty();
            }
            CustomAlert changed = patch.applyTo(existing.get());
            List<CustomAlert> alerts = new ArrayList<>();
            for (CustomAlert alert : current.get().customAlerts()) {
                alerts.add(alert.id().equals(alertId) ? changed : alert);
            }
            AlertPreferences updated = current.get().withCustomAlerts(alerts, clock.instant());
            store.put(updated);
            reconcileQuietly(updated);
            return Optional.of(changed);
        });
    }

    public boolean deleteCustomAlert(String alertId) {
        Optional<AlertPreferences> owner = store.ownerOfCustomAlert(alertId);
        if (owner.isEmpty()) {
            return false;
        }
        String locationId = owner.get().locationId();
        return locks.withLock(locationId, () -> {
            Optional<AlertPreferences> current = store.get(locationId);
            if (current.isEmpty() || current.get().customAlert(alertId).isEmpty()) {
                return false;
            }
            List<CustomAlert> alerts = current.get().customAlerts().stream()
                    .filter(alert -> !alert.id().equals(alertId))
                    .toList();
            AlertPreferences updated = current.get().withCustomAlerts(alerts, clock.instant());
            store.put(updated);
            reconcileQuietly(updated);
            return true;
        });
    }

    /**
     * Drops the location's preferences and every schedule it still has.
     */
    public boolean deleteLocation(String locationId) {
        return locks.withLock(locationId, () -> {
            boolean removed = store.remove(locationId);
            try {
                lifecycle.cancelLocation(locationId);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Schedules for deleted location " + locationId + " were not cancelled", e);
            }
            return removed;
        });
    }

    /**
     * Re-applies every stored preference set, as done on startup.
     *
     * @return number of locations reconciled without error
     */
    public int reconcileAll() {
        int reconciled = 0;
        for (AlertPreferences preferences : store.all()) {
            boolean ok = locks.withLock(preferences.locationId(), () -> store.get(preferences.locationId())
                    .map(this::reconcileQuietly)
                    .orElse(false));
            if (ok) {
                reconciled++;
            }
        }
        return reconciled;
    }

    private boolean reconcileQuietly(AlertPreferences preferences) {
        try {
            lifecycle.reconcile(preferences.locationId(), preferences);
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Reconcile failed for " + preferences.locationId() + " after saving preferences", e);
            return false;
        }
    }
}
