/* (C)2026 */
package com.ammann.regimeshift.model;

import java.time.LocalDate;

/** The metric values of a single day, as published to the event sink. */
public record MetricSnapshot(
        LocalDate date,
        double detections,
        double autocorrelation,
        double variance,
        double trend,
        double risk) {}
