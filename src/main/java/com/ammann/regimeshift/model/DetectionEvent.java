/* (C)2026 */
package com.ammann.regimeshift.model;

import java.time.Instant;

/**
 * A single raw observation of a species produced by a detection source.
 *
 * @param species    species label
 * @param observedAt observation time, or {@code null} when the source cannot supply one
 */
public record DetectionEvent(String species, Instant observedAt) {

    public static DetectionEvent of(String species, Instant observedAt) {
        return new DetectionEvent(species, observedAt);
    }
}
