/* (C)2026 */
package com.ammann.regimeshift.model;

import java.time.Instant;

/**
 * The most recent alert trigger. Records whether the condition fired and, separately,
 * whether the webhook delivery succeeded.
 */
public record TriggerRecord(Instant at, DeliveryResult delivery, AlertSignals signals) {}
