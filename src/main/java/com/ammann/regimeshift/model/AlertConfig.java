/* (C)2026 */
package com.ammann.regimeshift.model;

import java.net.URI;

/**
 * Immutable snapshot of the alert configuration and the last trigger.
 *
 * @param webhookTarget URL receiving alert POSTs, {@code null} if not subscribed
 * @param notifyAddress address for the secondary notification, {@code null} if not subscribed
 * @param thresholds    current trigger levels
 * @param lastTrigger   most recent trigger, {@code null} until the first one
 */
public record AlertConfig(
        URI webhookTarget,
        String notifyAddress,
        AlertThresholds thresholds,
        TriggerRecord lastTrigger) {

    public static AlertConfig initial(AlertThresholds thresholds) {
        return new AlertConfig(null, null, thresholds, null);
    }

    public AlertConfig withWebhookTarget(URI target) {
        return new AlertConfig(target, notifyAddress, thresholds, lastTrigger);
    }

    public AlertConfig withNotifyAddress(String address) {
        return new AlertConfig(webhookTarget, address, thresholds, lastTrigger);
    }

    public AlertConfig withThresholds(AlertThresholds newThresholds) {
        return new AlertConfig(webhookTarget, notifyAddress, newThresholds, lastTrigger);
    }

    public AlertConfig withLastTrigger(TriggerRecord trigger) {
        return new AlertConfig(webhookTarget, notifyAddress, thresholds, trigger);
    }
}
