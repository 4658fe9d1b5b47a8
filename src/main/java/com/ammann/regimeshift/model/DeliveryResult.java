/* (C)2026 */
package com.ammann.regimeshift.model;

import com.ammann.regimeshift.enumeration.DeliveryOutcome;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one delivery attempt.
 *
 * @param outcome    delivered, failed or skipped
 * @param statusCode HTTP status returned by the target, if a response was received
 * @param reason     failure or skip reason, {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryResult(DeliveryOutcome outcome, Integer statusCode, String reason) {

    public static DeliveryResult delivered(Integer statusCode) {
        return new DeliveryResult(DeliveryOutcome.DELIVERED, statusCode, null);
    }

    public static DeliveryResult failed(Integer statusCode, String reason) {
        return new DeliveryResult(DeliveryOutcome.FAILED, statusCode, reason);
    }

    public static DeliveryResult skipped(String reason) {
        return new DeliveryResult(DeliveryOutcome.SKIPPED, null, reason);
    }

    @JsonIgnore
    public boolean isDelivered() {
        return outcome == DeliveryOutcome.DELIVERED;
    }
}
