/* (C)2026 */
package com.ammann.regimeshift.notification;

import com.ammann.regimeshift.model.AlertPayload;
import com.ammann.regimeshift.model.DeliveryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Email notifier that logs the message it would send. No mail transport is wired in.
 */
@ApplicationScoped
public class LoggingEmailNotifier implements AlertNotifier {

    private static final Logger LOG = Logger.getLogger(LoggingEmailNotifier.class);
    private static final int MAX_LOGGED_BODY = 500;

    private final ObjectMapper objectMapper;

    @Inject
    public LoggingEmailNotifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DeliveryResult send(String address, AlertPayload payload) {
        try {
            String body = objectMapper.writeValueAsString(payload);
            if (body.length() > MAX_LOGGED_BODY) {
                body = body.substring(0, MAX_LOGGED_BODY);
            }
            LOG.infof("Simulated email sent to %s with payload: %s", address, body);
            return DeliveryResult.delivered(null);
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Could not render alert email for %s", address);
            return DeliveryResult.failed(null, "serialization failed: " + e.getOriginalMessage());
        }
    }
}
