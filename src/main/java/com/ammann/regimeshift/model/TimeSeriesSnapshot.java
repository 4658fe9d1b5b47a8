/* (C)2026 */
package com.ammann.regimeshift.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable content of the time series cache: the gap-filled daily series of every species
 * together with the instant they were built.
 *
 * <p>Both components are published together through a single reference, so a reader can never
 * see a build time that does not belong to the data next to it.
 *
 * @param data    species to contiguous daily counts, ordered by day
 * @param builtAt build completion time, {@code null} before the first build
 */
public record TimeSeriesSnapshot(Map<String, List<DailyCount>> data, Instant builtAt) {

    /** Snapshot held before anything has been built. */
    public static final TimeSeriesSnapshot UNBUILT = new TimeSeriesSnapshot(Map.of(), null);

    public boolean isBuilt() {
        return builtAt != null;
    }

    /**
     * Returns {@code true} if the snapshot was built less than {@code ttl} before {@code now}.
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return builtAt != null && Duration.between(builtAt, now).compareTo(ttl) < 0;
    }

    public long totalDetections() {
        return data.values().stream()
                .flatMap(List::stream)
                .mapToLong(DailyCount::count)
                .sum();
    }
}
