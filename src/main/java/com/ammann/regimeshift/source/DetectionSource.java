/* (C)2026 */
package com.ammann.regimeshift.source;

import com.ammann.regimeshift.model.DetectionEvent;
import java.time.Instant;
import java.util.List;

/**
 * Provider of raw species detections.
 *
 * <p>Implementations must not throw for an empty or absent source; they return an empty list.
 * Callers still guard against failures, treating them the same as an empty source.
 */
public interface DetectionSource {

    /**
     * Enumerates every detection currently known to the source.
     *
     * @return detections in no particular order, never {@code null}
     */
    List<DetectionEvent> listEvents();

    /**
     * Observation time to assume for events that carry none.
     */
    default Instant fallbackObservedAt() {
        return Instant.now();
    }
}
