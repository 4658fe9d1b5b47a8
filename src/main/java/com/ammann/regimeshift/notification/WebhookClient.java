/* (C)2026 */
package com.ammann.regimeshift.notification;

import com.ammann.regimeshift.model.AlertPayload;
import com.ammann.regimeshift.model.DeliveryResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Posts alert payloads as JSON to a webhook target.
 *
 * <p>One attempt per alert, bounded by the configured timeout for both connect and response.
 * Network errors, timeouts and non-2xx responses are logged and reported as a failed
 * {@link DeliveryResult}; this class never throws to its caller.
 */
@ApplicationScoped
public class WebhookClient {

    private static final Logger LOG = Logger.getLogger(WebhookClient.class);

    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final HttpClient httpClient;

    @Inject
    public WebhookClient(
            ObjectMapper objectMapper,
            @ConfigProperty(name = "regime.alerts.webhook-timeout", defaultValue = "PT5S") Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Delivers the payload to {@code target}.
     *
     * @param target  absolute http(s) URL
     * @param payload alert body
     * @return delivered with the response status, or failed with the reason
     */
    public DeliveryResult post(URI target, AlertPayload payload) {
        try {
            String body = objectMapper.writeValueAsString(payload);
            HttpRequest request = HttpRequest.newBuilder(target)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                LOG.infof("Alert webhook delivered to %s, status=%d", target, status);
                return DeliveryResult.delivered(status);
            }
            LOG.warnf("Alert webhook to %s rejected with status %d", target, status);
            return DeliveryResult.failed(status, "HTTP " + status);

        } catch (HttpTimeoutException e) {
            LOG.errorf("Webhook POST to %s timed out after %s", target, timeout);
            return DeliveryResult.failed(null, "timeout after " + timeout.toMillis() + "ms");
        } catch (IOException | IllegalArgumentException e) {
            LOG.errorf("Webhook POST to %s failed: %s", target, e.toString());
            return DeliveryResult.failed(null, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Webhook POST to %s interrupted", target);
            return DeliveryResult.failed(null, "interrupted");
        }
    }

    Duration timeout() {
        return timeout;
    }
}
