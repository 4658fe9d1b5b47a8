/* (C)2026 */
package com.ammann.regimeshift.service;

import com.ammann.regimeshift.model.DailyCount;
import com.ammann.regimeshift.model.DetectionEvent;
import com.ammann.regimeshift.model.TimeSeriesSnapshot;
import com.ammann.regimeshift.source.DetectionSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds and caches gap-filled daily detection series per species.
 *
 * <p>The cache is considered fresh for the configured TTL after a build. Rebuilds always recompute
 * everything from the detection source and replace the cached snapshot as a whole. Concurrent
 * callers that need a rebuild while one is already running wait for that rebuild and share its
 * result instead of starting another scan.
 *
 * <p>An empty or failing source produces an empty mapping. It is cached like any other result,
 * so a missing source is scanned at most once per TTL window.
 */
@ApplicationScoped
public class TimeSeriesBuilder {

    private static final Logger LOG = Logger.getLogger(TimeSeriesBuilder.class);

    private final DetectionSource source;
    private final Clock clock;
    private final Duration ttl;
    private final ZoneId zone;

    private final AtomicReference<TimeSeriesSnapshot> cache = new AtomicReference<>(TimeSeriesSnapshot.UNBUILT);
    private final AtomicReference<CompletableFuture<TimeSeriesSnapshot>> inFlight = new AtomicReference<>();

    @Inject
    public TimeSeriesBuilder(
            DetectionSource source,
            Clock clock,
            @ConfigProperty(name = "regime.timeseries.ttl", defaultValue = "PT10M") Duration ttl,
            @ConfigProperty(name = "regime.timeseries.zone", defaultValue = "UTC") String zone) {
        this.source = source;
        this.clock = clock;
        this.ttl = ttl;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Returns the daily series of every species, rebuilding when the cache is stale or when forced.
     *
     * @param forceRebuild rebuild even if the cache is still fresh
     * @return species to contiguous daily counts; empty when the source has no data
     */
    public Map<String, List<DailyCount>> getOrBuild(boolean forceRebuild) {
        TimeSeriesSnapshot current = cache.get();
        if (!forceRebuild && current.isFresh(clock.instant(), ttl)) {
            return current.data();
        }
        return rebuild(forceRebuild).data();
    }

    /**
     * Returns the cached snapshot without triggering a build.
     */
    public TimeSeriesSnapshot snapshot() {
        return cache.get();
    }

    /**
     * Species ordered by total detections, highest first.
     *
     * @param limit maximum number of species returned
     */
    public List<String> topSpeciesByVolume(int limit) {
        return getOrBuild(false).entrySet().stream()
                .sorted(Comparator.comparingLong(
                                (Map.Entry<String, List<DailyCount>> e) -> totalCount(e.getValue()))
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .toList();
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Runs a rebuild, or joins the one already in flight.
     */
    TimeSeriesSnapshot rebuild(boolean forceRebuild) {
        CompletableFuture<TimeSeriesSnapshot> pending = new CompletableFuture<>();
        CompletableFuture<TimeSeriesSnapshot> running = inFlight.compareAndExchange(null, pending);
        if (running != null) {
            LOG.debug("Time series rebuild already in progress, waiting for it");
            return running.join();
        }

        try {
            // another caller may have finished a rebuild between our freshness check and here
            TimeSeriesSnapshot latest = cache.get();
            if (!forceRebuild && latest.isFresh(clock.instant(), ttl)) {
                pending.complete(latest);
                return latest;
            }

            TimeSeriesSnapshot built = buildSnapshot();
            cache.set(built);
            pending.complete(built);
            return built;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.set(null);
        }
    }

    private TimeSeriesSnapshot buildSnapshot() {
        long startNanos = System.nanoTime();

        List<DetectionEvent> events = loadEvents();
        Map<String, TreeMap<LocalDate, Long>> buckets = new TreeMap<>();
        Instant fallback = null;
        int skipped = 0;

        for (DetectionEvent event : events) {
            if (event == null || event.species() == null || event.species().isBlank()) {
                skipped++;
                continue;
            }
            Instant observedAt = event.observedAt();
            if (observedAt == null) {
                if (fallback == null) {
                    fallback = fallbackObservedAt();
                }
                observedAt = fallback;
            }
            LocalDate day = LocalDate.ofInstant(observedAt, zone);
            buckets.computeIfAbsent(event.species(), k -> new TreeMap<>()).merge(day, 1L, Long::sum);
        }

        Map<String, List<DailyCount>> series = new TreeMap<>();
        buckets.forEach((species, byDay) -> series.put(species, fillGaps(byDay)));

        TimeSeriesSnapshot snapshot =
                new TimeSeriesSnapshot(Collections.unmodifiableMap(series), clock.instant());

        if (skipped > 0) {
            LOG.warnf("Skipped %d detections without a species label", skipped);
        }
        LOG.infof("Time series rebuilt in %.1fms: %d events, %d species",
                (System.nanoTime() - startNanos) / 1_000_000.0, events.size() - skipped, series.size());
        return snapshot;
    }

    private List<DetectionEvent> loadEvents() {
        try {
            List<DetectionEvent> events = source.listEvents();
            return events != null ? events : List.of();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Detection source unavailable, caching empty series for %s", ttl);
            return List.of();
        }
    }

    private Instant fallbackObservedAt() {
        try {
            Instant fallback = source.fallbackObservedAt();
            return fallback != null ? fallback : clock.instant();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Detection source has no fallback observation time, using build time");
            return clock.instant();
        }
    }

    /**
     * Expands sparse day counts into one entry per day from the first to the last observed day.
     */
    static List<DailyCount> fillGaps(TreeMap<LocalDate, Long> byDay) {
        List<DailyCount> filled = new ArrayList<>();
        LocalDate last = byDay.lastKey();
        for (LocalDate day = byDay.firstKey(); !day.isAfter(last); day = day.plusDays(1)) {
            filled.add(new DailyCount(day, byDay.getOrDefault(day, 0L)));
        }
        return List.copyOf(filled);
    }

    private static long totalCount(List<DailyCount> series) {
        return series.stream().mapToLong(DailyCount::count).sum();
    }
}
