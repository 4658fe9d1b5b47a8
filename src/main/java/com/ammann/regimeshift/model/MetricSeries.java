/* (C)2026 */
package com.ammann.regimeshift.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Early-warning metrics of one species, aligned index-for-index with its daily series.
 *
 * <p>{@code autocorrelation} values lie in [-1, 1], {@code variance} values are non-negative and
 * {@code risk} values lie in [0, 100].
 */
public record MetricSeries(
        String species,
        List<LocalDate> dates,
        List<Double> detections,
        List<Double> autocorrelation,
        List<Double> variance,
        List<Double> trend,
        List<Double> risk) {

    public static MetricSeries empty(String species) {
        return new MetricSeries(species, List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return dates.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return dates.isEmpty();
    }

    /** Metrics of the most recent day, if any. */
    public Optional<MetricSnapshot> latest() {
        if (dates.isEmpty()) {
            return Optional.empty();
        }
        int last = dates.size() - 1;
        return Optional.of(new MetricSnapshot(
                dates.get(last),
                detections.get(last),
                autocorrelation.get(last),
                variance.get(last),
                trend.get(last),
                risk.get(last)));
    }
}
