/* (C)2026 */
package com.ammann.regimeshift.notification;

import com.ammann.regimeshift.model.AlertPayload;
import com.ammann.regimeshift.model.DeliveryResult;

/**
 * Secondary alert channel addressed by a free-form address, e.g. an email inbox.
 */
public interface AlertNotifier {

    /**
     * Sends the alert. Implementations report failures through the result instead of throwing.
     */
    DeliveryResult send(String address, AlertPayload payload);
}
