package com.airbrief.service.runtime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * At most one pending job per schedule, ordered by run time.
 */
final class RefreshQueue {
    private static final Comparator<RefreshJob> ORDER = Comparator.comparing(RefreshJob::runAt)
            .thenComparing(RefreshJob::key);

    private final Map<String, RefreshJob> byKey = new HashMap<>();
    private final TreeSet<RefreshJob> ordered = new TreeSet<>(ORDER);

    synchronized void put(RefreshJob job) {
        RefreshJob previous = byKey.put(job.key(), job);
        if (previous != null) {
            ordered.remove(previous);
        }
        ordered.add(job);
    }

    synchronized boolean remove(String locationId, String variantId) {
        RefreshJob previous = byKey.remove(locationId + "|" + variantId);
        if (previous == null) {
            return false;
        }
        ordered.remove(previous);
        return true;
    }

    /**
     * Removes and returns every job whose run time is not after {@code now}, earliest first.
     */
    synchronized List<RefreshJob> pollDue(Instant now) {
        List<RefreshJob> due = new ArrayList<>();
        while (!ordered.isEmpty() && !ordered.first().runAt().isAfter(now)) {
            RefreshJob job = ordered.pollFirst();
            byKey.remove(job.key());
            due.add(job);
        }
        return due;
    }

    synchronized Optional<RefreshJob> peek() {
        return ordered.isEmpty() ? Optional.empty() : Optional.of(ordered.first());
    }

    synchronized List<RefreshJob> snapshot() {
        return new ArrayList<>(ordered);
    }

    synchronized int size() {
        return ordered.size();
    }
}
