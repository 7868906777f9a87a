package com.airbrief.content.generator;

import com.airbrief.content.api.GenerationBackend;
import com.airbrief.core.model.AlertVariant;
import com.airbrief.core.model.EnvironmentalSnapshot;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces a push-notification body for a snapshot. Every failure mode (backend error,
 * timeout, blank output) degrades to {@link FallbackMessages}; this class never throws from
 * {@link #generate}. Calls are not retried.
 */
public final class AlertGenerator implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(AlertGenerator.class.getName());
    private static final String ELLIPSIS = "...";

    private final GenerationBackend backend;
    private final GeneratorSettings settings;
    private final ExecutorService executor;

    public AlertGenerator(GenerationBackend backend, GeneratorSettings settings) {
        this.backend = Objects.requireNonNull(backend, "backend is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.executor = Executors.newFixedThreadPool(settings.maxConcurrentCalls(), daemonThreads());
    }

    public String generate(EnvironmentalSnapshot snapshot, AlertVariant variant, String displayName) {
        return generateDetailed(snapshot, variant, displayName).message();
    }

    public GeneratedAlert generateDetailed(EnvironmentalSnapshot snapshot, AlertVariant variant, String displayName) {
        String fallback = FallbackMessages.forKind(variant.kind());
        String alertName = displayName == null || displayName.isBlank() ? variant.kind().defaultName() : displayName.trim();
        String context = "\"" + alertName + "\" at " + snapshot.locationId();
        String systemPrompt = AlertPrompts.systemPrompt(settings.maxChars());
        String userPrompt = AlertPrompts.userPrompt(snapshot, variant.kind(), alertName, settings.maxChars());

        Optional<String> raw = complete(systemPrompt, userPrompt, settings.maxTokens(), context);
        if (raw.isEmpty()) {
            return new GeneratedAlert(fallback, true);
        }

        String message = fitToLimit(raw.get(), settings.maxChars());
        if (message.isEmpty()) {
            LOGGER.warning("Generation returned no content; using fallback for " + context);
            return new GeneratedAlert(fallback, true);
        }
        return new GeneratedAlert(message, false);
    }

    /**
     * Runs one backend call on the bounded pool, abandoning it after the configured timeout.
     *
     * @param context names the request in log lines
     * @return the raw completion, or empty when the call failed, timed out or was not accepted
     */
    public Optional<String> complete(String systemPrompt, String userPrompt, int maxTokens, String context) {
        Future<String> call;
        try {
            call = executor.submit(() -> backend.generate(systemPrompt, userPrompt, maxTokens));
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Generator is shut down; using fallback for " + context, e);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(call.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            call.cancel(true);
            LOGGER.warning("Generation timed out after " + settings.timeout().toMillis() + " ms; using fallback for " + context);
            return Optional.empty();
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Generation failed; using fallback for " + context, e.getCause());
            return Optional.empty();
        }
    }

    /**
     * Trims, drops wrapping quotes and truncates with an ellipsis so the result never exceeds
     * {@code maxChars}.
     */
    static String fitToLimit(String raw, int maxChars) {
        if (raw == null) {
            return "";
        }
        String text = stripQuotes(raw.trim()).trim();
        if (text.length() <= maxChars) {
            return text;
        }
        int cut = maxChars - ELLIPSIS.length();
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + ELLIPSIS;
    }

    private static String stripQuotes(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' && last == '"') || (first == '“' && last == '”')) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "alert-generator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
