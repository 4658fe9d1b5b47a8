/* (C)2026 */
package com.ammann.regimeshift.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON body posted to the webhook target and handed to notifiers when an alert fires.
 */
public record AlertPayload(
        String type,
        String timestamp,
        AlertSignals signals,
        AlertThresholds thresholds,
        String summary,
        Map<String, Object> context) {

    public static final String TYPE = "regime.alert";
    public static final String SUMMARY = "Early warning thresholds exceeded";

    public static AlertPayload create(
            Instant at, AlertSignals signals, AlertThresholds thresholds, Map<String, Object> context) {
        return new AlertPayload(
                TYPE,
                at.toString(),
                signals,
                thresholds,
                SUMMARY,
                context == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(context)));
    }
}
