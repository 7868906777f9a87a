package com.airbrief.service;

import com.airbrief.content.cache.ContentCache;
import com.airbrief.content.generator.AlertContentResolver;
import com.airbrief.content.generator.AlertGenerator;
import com.airbrief.content.summary.LocationSummaryService;
import com.airbrief.core.bus.EventBus;
import com.airbrief.core.model.LocationRecord;
import com.airbrief.service.config.AlertServiceConfig;
import com.airbrief.service.config.ConfigLoader;
import com.airbrief.service.env.AirNowClient;
import com.airbrief.service.env.EnvSnapshotProvider;
import com.airbrief.service.env.JsonFileLocationDirectory;
import com.airbrief.service.env.NoaaClient;
import com.airbrief.service.notify.InMemoryNotificationPlatform;
import com.airbrief.service.notify.NotificationLifecycleManager;
import com.airbrief.service.notify.NotificationPermission;
import com.airbrief.service.notify.ScheduleRegistry;
import com.airbrief.service.openai.OpenAiGenerationBackend;
import com.airbrief.service.prefs.AlertPreferencesService;
import com.airbrief.service.prefs.PreferenceStore;
import com.airbrief.service.runtime.MaintenanceScheduler;
import com.airbrief.service.store.EventCodec;
import com.airbrief.service.store.JsonFileContentStore;
import com.airbrief.service.store.JsonlEventStore;
import com.airbrief.service.summary.LocationSummaryLookup;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configDir = Path.of("config");
        Path eventLogFile = Path.of("logs/events.jsonl");
        AlertServiceConfig config = ConfigLoader.loadAlerts(configDir);
        Secrets secrets = resolveSecrets(System.getenv(), LOGGER::warning);
        Path dataDir = Path.of(config.dataDirOrDefault());
        Clock clock = Clock.system(config.zone());

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        ContentCache cache = new ContentCache(
                new JsonFileContentStore(dataDir.resolve("content-cache.json")),
                clock,
                config.cache().toSettings()
        );
        AlertGenerator generator = new AlertGenerator(
                new OpenAiGenerationBackend(
                        httpClient,
                        URI.create(config.openAi().endpointOrDefault()),
                        secrets.openAiApiKey(),
                        config.openAi().modelOrDefault(),
                        config.openAi().temperatureOrDefault(),
                        config.openAi().requestTimeout()
                ),
                config.generator().toSettings()
        );
        ContentCache summaryCache = new ContentCache(
                new JsonFileContentStore(dataDir.resolve("summary-cache.json")),
                clock,
                config.summaryCache().toSettings()
        );
        LocationSummaryService summaryService = new LocationSummaryService(summaryCache, generator, eventBus, clock);
        EnvSnapshotProvider snapshots = new EnvSnapshotProvider(
                new AirNowClient(httpClient, Duration.ofSeconds(6), clock, secrets.airNowApiKey()),
                new NoaaClient(httpClient, Duration.ofSeconds(6), clock, secrets.noaaUserAgent()),
                clock
        );
        JsonFileLocationDirectory locations = new JsonFileLocationDirectory(dataDir.resolve("locations.json"));
        NotificationLifecycleManager lifecycle = new NotificationLifecycleManager(
                new InMemoryNotificationPlatform(),
                NotificationPermission.GRANTED,
                locations,
                snapshots,
                new AlertContentResolver(cache, generator, eventBus, clock),
                new ScheduleRegistry(dataDir.resolve("schedules.json")),
                eventBus,
                clock
        );
        AlertPreferencesService preferences = new AlertPreferencesService(
                new PreferenceStore(dataDir.resolve("preferences.json")),
                lifecycle,
                clock
        );
        LocationSummaryLookup summaries = new LocationSummaryLookup(locations, snapshots, summaryService);
        MaintenanceScheduler maintenance = new MaintenanceScheduler(
                lifecycle,
                List.of(cache, summaryCache),
                eventBus,
                clock,
                new MaintenanceScheduler.Settings(
                        config.maintenance().refreshLead(),
                        config.maintenance().tickInterval(),
                        config.maintenance().sweepInterval(),
                        config.maintenance().sweepMaxAgeDaysOrDefault()
                )
        );

        lifecycle.forgetUnregistered();
        int reconciled = preferences.reconcileAll();
        LOGGER.info("Reconciled alert schedules for " + reconciled + " locations");
        for (LocationRecord location : locations.all()) {
            summaries.forLocation(location.id()).ifPresent(resolved -> LOGGER.info(
                    "Summary for " + location.id() + " (" + resolved.origin() + "): " + resolved.summary().headline()));
        }
        maintenance.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            maintenance.shutdown();
            generator.close();
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static Secrets resolveSecrets(Map<String, String> env, Consumer<String> warn) {
        String openAiKey = env.getOrDefault("OPENAI_API_KEY", "").trim();
        if (openAiKey.isEmpty()) {
            warn.accept("OPENAI_API_KEY is not set; alerts will use fallback text.");
        }
        String airNowKey = env.getOrDefault("AIRNOW_API_KEY", "").trim();
        if (airNowKey.isEmpty()) {
            warn.accept("AIRNOW_API_KEY is not set; AQI readings will be unknown.");
        }
        String userAgent = env.getOrDefault("NOAA_USER_AGENT", "").trim();
        if (userAgent.isEmpty()) {
            userAgent = "airbrief-alerts/0.1 (contact: support@example.com)";
        }
        return new Secrets(openAiKey, airNowKey, userAgent);
    }

    record Secrets(String openAiApiKey, String airNowApiKey, String noaaUserAgent) {
    }
}
