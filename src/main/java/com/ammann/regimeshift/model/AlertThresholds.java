/* (C)2026 */
package com.ammann.regimeshift.model;

/**
 * Trigger levels for the two early-warning signals.
 */
public record AlertThresholds(double variance, double autocorrelation) {

    public static final double DEFAULT_VARIANCE = 0.7;
    public static final double DEFAULT_AUTOCORRELATION = 0.7;

    public static AlertThresholds defaults() {
        return new AlertThresholds(DEFAULT_VARIANCE, DEFAULT_AUTOCORRELATION);
    }

    /**
     * Returns these thresholds with each supplied value replaced; {@code null} keeps the current one.
     */
    public AlertThresholds merge(Double newVariance, Double newAutocorrelation) {
        return new AlertThresholds(
                newVariance != null ? newVariance : variance,
                newAutocorrelation != null ? newAutocorrelation : autocorrelation);
    }

    /**
     * Either signal reaching its threshold is enough to fire.
     */
    public boolean isExceededBy(AlertSignals signals) {
        return signals.variance() >= variance || signals.autocorrelation() >= autocorrelation;
    }
}
