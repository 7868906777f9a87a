package com.airbrief.service.runtime;

import com.airbrief.content.cache.ContentCache;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.events.AlertRaised;
import com.airbrief.core.events.CacheSwept;
import com.airbrief.core.events.NotificationCancelled;
import com.airbrief.core.events.NotificationScheduled;
import com.airbrief.service.notify.NotificationLifecycleManager;
import com.airbrief.service.notify.ScheduleRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background upkeep: refreshes each recurring schedule's content a little before it fires and
 * periodically sweeps stale cache entries.
 * <p>
 * Refresh jobs follow the lifecycle events, so the queue never needs to poll the registry.
 * A job runs once per fire; re-registering from the refresh enqueues the following day.
 */
public class MaintenanceScheduler {
    private static final Logger LOGGER = Logger.getLogger(MaintenanceScheduler.class.getName());

    private final NotificationLifecycleManager lifecycle;
    private final List<ContentCache> caches;
    private final EventBus eventBus;
    private final Clock clock;
    private final Settings settings;
    private final RefreshQueue queue = new RefreshQueue();
    private final List<Runnable> subscriptions;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "alert-maintenance");
        thread.setDaemon(true);
        return thread;
    });

    public MaintenanceScheduler(
            NotificationLifecycleManager lifecycle,
            ContentCache cache,
            EventBus eventBus,
            Clock clock,
            Settings settings
    ) {
        this(lifecycle, List.of(Objects.requireNonNull(cache, "cache is required")), eventBus, clock, settings);
    }

    /**
     * @param caches every cache the periodic sweep covers; each sweep publishes one {@link CacheSwept} per cache
     */
    public MaintenanceScheduler(
            NotificationLifecycleManager lifecycle,
            List<ContentCache> caches,
            EventBus eventBus,
            Clock clock,
            Settings settings
    ) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle is required");
        this.caches = List.copyOf(Objects.requireNonNull(caches, "caches is required"));
        if (this.caches.isEmpty()) {
            throw new IllegalArgumentException("at least one cache is required");
        }
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.subscriptions = List.of(
                eventBus.subscribe(NotificationScheduled.class, this::onScheduled),
                eventBus.subscribe(NotificationCancelled.class, this::onCancelled)
        );
    }

    public void start() {
        long tickMillis = settings.tickInterval().toMillis();
        timerExecutor.scheduleAtFixedRate(this::runDueJobs, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        long sweepMillis = settings.sweepInterval().toMillis();
        timerExecutor.scheduleAtFixedRate(this::sweepNow, 0, sweepMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Maintenance started: refresh lead " + settings.refreshLead()
                + ", tick " + settings.tickInterval() + ", sweep every " + settings.sweepInterval());
    }

    /**
     * Runs every job whose time has come. Failures are published as {@link AlertRaised} and do
     * not stop the remaining jobs.
     *
     * @return number of jobs that ran
     */
    public int runDueJobs() {
        List<RefreshJob> due = queue.pollDue(clock.instant());
        for (RefreshJob job : due) {
            String handle = null;
            try {
                handle = lifecycle.refresh(job.locationId(), job.variantId());
                if (handle == null) {
                    LOGGER.fine(() -> "Refresh produced no schedule for " + job.key());
                }
            } catch (RuntimeException e) {
                raise("refresh", "Refresh failed for " + job.key() + " - " + e.getMessage(), Map.of(
                        "locationId", job.locationId(),
                        "variantId", job.variantId()
                ));
            }
            if (handle == null) {
                requeueIfStillScheduled(job);
            }
        }
        return due.size();
    }

    /**
     * Sweeps every cache; a cache that fails is reported and the rest are still swept.
     *
     * @return number of cache entries removed across all caches
     */
    public int sweepNow() {
        int maxAgeDays = settings.sweepMaxAgeDays();
        int total = 0;
        for (ContentCache cache : caches) {
            try {
                int removed = cache.sweep(maxAgeDays);
                eventBus.publish(new CacheSwept(clock.instant(), cache.sweepCutoff(maxAgeDays), removed));
                total += removed;
            } catch (RuntimeException e) {
                raise("sweep", "Cache sweep failed - " + e.getMessage(), Map.of());
            }
        }
        return total;
    }

    public List<RefreshJob> pendingJobs() {
        return queue.snapshot();
    }

    public Optional<RefreshJob> nextJob() {
        return queue.peek();
    }

    public void shutdown() {
        subscriptions.forEach(Runnable::run);
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onScheduled(NotificationScheduled event) {
        if (!event.recurring()) {
            return;
        }
        Instant nextFire = nextFireAfterLead(LocalTime.of(event.hour(), event.minute()));
        queue.put(new RefreshJob(event.locationId(), event.variantId(), nextFire, nextFire.minus(settings.refreshLead())));
    }

    /**
     * A refresh that did not re-register leaves the old trigger live, so its next fire still
     * needs a refresh.
     */
    private void requeueIfStillScheduled(RefreshJob job) {
        Optional<ScheduleRecord> record;
        try {
            record = lifecycle.activeSchedules(job.locationId()).stream()
                    .filter(candidate -> candidate.variantId().equals(job.variantId()))
                    .findFirst();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not read schedules for " + job.key() + "; refresh not re-queued", e);
            return;
        }
        record.ifPresent(existing -> {
            Instant nextFire = nextFireAfterLead(existing.timeOfDay());
            queue.put(new RefreshJob(job.locationId(), job.variantId(), nextFire, nextFire.minus(settings.refreshLead())));
            LOGGER.info("Refresh for " + job.key() + " did not re-register; retrying before " + nextFire);
        });
    }

    private void onCancelled(NotificationCancelled event) {
        queue.remove(event.locationId(), event.variantId());
    }

    /**
     * Earliest daily occurrence of {@code time} whose refresh point lies strictly in the future.
     */
    Instant nextFireAfterLead(LocalTime time) {
        Instant now = clock.instant();
        ZonedDateTime candidate = ZonedDateTime.now(clock).with(time).withSecond(0).withNano(0);
        while (!candidate.toInstant().minus(settings.refreshLead()).isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    private void raise(String category, String message, Map<String, Object> details) {
        LOGGER.warning(message);
        eventBus.publish(new AlertRaised(clock.instant(), category, message, details));
    }

    public record Settings(Duration refreshLead, Duration tickInterval, Duration sweepInterval, int sweepMaxAgeDays) {
        public Settings {
            Objects.requireNonNull(refreshLead, "refreshLead is required");
            Objects.requireNonNull(tickInterval, "tickInterval is required");
            Objects.requireNonNull(sweepInterval, "sweepInterval is required");
            if (refreshLead.isNegative()) {
                throw new IllegalArgumentException("refreshLead must be >= 0");
            }
            if (sweepMaxAgeDays < 0) {
                throw new IllegalArgumentException("sweepMaxAgeDays must be >= 0");
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofMinutes(10), Duration.ofSeconds(60), Duration.ofHours(6), 2);
        }
    }
}
