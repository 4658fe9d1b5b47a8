/* (C)2026 */
package com.ammann.regimeshift.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one alert evaluation. {@code delivery} is only present when the alert fired.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationResult(boolean triggered, DeliveryResult delivery) {

    public static EvaluationResult notTriggered() {
        return new EvaluationResult(false, null);
    }

    public static EvaluationResult triggered(DeliveryResult delivery) {
        return new EvaluationResult(true, delivery);
    }
}
