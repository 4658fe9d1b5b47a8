/* (C)2026 */
package com.ammann.regimeshift.service;

import com.ammann.regimeshift.config.ExecutorProducer;
import com.ammann.regimeshift.event.EventSink;
import com.ammann.regimeshift.exception.ValidationException;
import com.ammann.regimeshift.model.AlertConfig;
import com.ammann.regimeshift.model.AlertPayload;
import com.ammann.regimeshift.model.AlertSignals;
import com.ammann.regimeshift.model.AlertThresholds;
import com.ammann.regimeshift.model.DeliveryResult;
import com.ammann.regimeshift.model.EvaluationResult;
import com.ammann.regimeshift.model.TriggerRecord;
import com.ammann.regimeshift.notification.AlertNotifier;
import com.ammann.regimeshift.notification.WebhookClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;
import org.jboss.logging.Logger;

/**
 * Evaluates early-warning signals against the configured thresholds and dispatches alerts.
 *
 * <p>An alert fires when the variance <em>or</em> the autocorrelation reaches its threshold.
 * A fired alert is posted once to the webhook target and handed to the secondary notifier;
 * the two deliveries are independent and neither can make evaluation fail. Every fired alert
 * overwrites the last trigger record, whatever the delivery outcome.
 *
 * <p>{@link #schedule(AlertSignals, Map)} runs the evaluation on the alert dispatch executor so
 * the caller does not wait for webhook latency; the returned future completes with the result.
 */
@ApplicationScoped
public class AlertEvaluator {

    private static final Logger LOG = Logger.getLogger(AlertEvaluator.class);

    static final AlertSignals TEST_SIGNALS = new AlertSignals(0.9, 0.85);
    static final String DISPATCH_QUEUE_FULL = "dispatch queue full";

    private final AlertConfigStore store;
    private final WebhookClient webhookClient;
    private final AlertNotifier notifier;
    private final EventSink eventSink;
    private final Clock clock;
    private final Executor executor;

    private final Counter triggeredCounter;
    private final Counter deliveryFailureCounter;
    private final Counter dispatchRejectedCounter;

    @Inject
    public AlertEvaluator(
            AlertConfigStore store,
            WebhookClient webhookClient,
            AlertNotifier notifier,
            EventSink eventSink,
            MeterRegistry meterRegistry,
            Clock clock,
            @Named(ExecutorProducer.ALERT_DISPATCH_EXECUTOR) Executor executor) {
        this.store = store;
        this.webhookClient = webhookClient;
        this.notifier = notifier;
        this.eventSink = eventSink;
        this.clock = clock;
        this.executor = executor;

        this.triggeredCounter = Counter.builder("regime_alerts_triggered_total")
                .description("Alerts whose thresholds were crossed")
                .register(meterRegistry);
        this.deliveryFailureCounter = Counter.builder("regime_alert_delivery_failures_total")
                .description("Fired alerts whose webhook delivery failed")
                .register(meterRegistry);
        this.dispatchRejectedCounter = Counter.builder("regime_alert_dispatch_rejected_total")
                .description("Evaluations the alert dispatch executor did not accept")
                .register(meterRegistry);
    }

    /**
     * Merges the supplied fields into the alert configuration; {@code null} arguments leave the
     * corresponding field unchanged.
     *
     * @param webhookTarget absolute http(s) URL
     * @param notifyAddress email-style address
     * @param thresholds    new thresholds
     * @return the configuration after the update
     * @throws ValidationException if any supplied field is malformed; nothing is changed then
     */
    public AlertConfig subscribe(String webhookTarget, String notifyAddress, AlertThresholds thresholds) {
        return subscribe(
                webhookTarget,
                notifyAddress,
                thresholds != null ? thresholds.variance() : null,
                thresholds != null ? thresholds.autocorrelation() : null);
    }

    /**
     * Merges the supplied fields into the alert configuration. Each threshold is applied on its own
     * against the thresholds in force when the update is applied, so concurrent partial updates
     * of different thresholds both take effect.
     *
     * @param variance        new variance threshold, {@code null} to keep the current one
     * @param autocorrelation new autocorrelation threshold, {@code null} to keep the current one
     * @throws ValidationException if any supplied field is malformed; nothing is changed then
     */
    public AlertConfig subscribe(String webhookTarget, String notifyAddress, Double variance, Double autocorrelation) {
        URI target = webhookTarget != null ? parseWebhookTarget(webhookTarget) : null;
        String address = notifyAddress != null ? validateNotifyAddress(notifyAddress) : null;
        if (variance != null) {
            validateThreshold("thresholds.variance", variance);
        }
        if (autocorrelation != null) {
            validateThreshold("thresholds.autocorrelation", autocorrelation);
        }

        UnaryOperator<AlertConfig> change = c -> {
            AlertConfig next = c;
            if (target != null) {
                next = next.withWebhookTarget(target);
            }
            if (address != null) {
                next = next.withNotifyAddress(address);
            }
            if (variance != null || autocorrelation != null) {
                next = next.withThresholds(c.thresholds().merge(variance, autocorrelation));
            }
            return next;
        };
        AlertConfig updated = store.update(change);

        LOG.infof("Alert subscription updated: webhook=%s, notify=%s, thresholds=%s",
                updated.webhookTarget(), updated.notifyAddress(), updated.thresholds());
        return updated;
    }

    /**
     * Read-only snapshot of the configuration including the last trigger.
     */
    public AlertConfig status() {
        return store.current();
    }

    /**
     * Evaluates the signals and, if a threshold is reached, delivers the alert. Never throws.
     *
     * @param signals current variance and autocorrelation
     * @param context caller data copied into the alert payload
     * @return whether the alert fired and, if so, the webhook delivery outcome
     */
    public EvaluationResult evaluate(AlertSignals signals, Map<String, Object> context) {
        return evaluate(signals, context, true);
    }

    private EvaluationResult evaluate(AlertSignals signals, Map<String, Object> context, boolean dispatched) {
        AlertThresholds thresholds = store.current().thresholds();
        if (!thresholds.isExceededBy(signals)) {
            LOG.debugf("Signals below thresholds: %s vs %s", signals, thresholds);
            return EvaluationResult.notTriggered();
        }

        Instant at = clock.instant();
        AlertPayload payload = AlertPayload.create(at, signals, thresholds, context);
        AlertConfig config = store.current();

        DeliveryResult delivery;
        if (dispatched) {
            delivery = deliverWebhook(config.webhookTarget(), payload);
            notifySecondary(config.notifyAddress(), payload);
        } else if (config.webhookTarget() == null) {
            delivery = DeliveryResult.skipped("no webhook target configured");
        } else {
            delivery = DeliveryResult.failed(null, DISPATCH_QUEUE_FULL);
        }

        store.recordTrigger(new TriggerRecord(at, delivery, signals));
        triggeredCounter.increment();
        if (!delivery.isDelivered() && config.webhookTarget() != null) {
            deliveryFailureCounter.increment();
        }
        publish(payload);

        LOG.infof("Alert triggered: variance=%.4f, autocorrelation=%.4f, delivery=%s",
                signals.variance(), signals.autocorrelation(), delivery.outcome());
        return EvaluationResult.triggered(delivery);
    }

    /**
     * Runs {@link #evaluate(AlertSignals, Map)} on the alert dispatch executor.
     *
     * <p>When the executor rejects the task the thresholds are still checked on the calling thread.
     * A crossing is then recorded as a trigger whose webhook delivery failed with the reason
     * {@value #DISPATCH_QUEUE_FULL}, and nothing is sent.
     *
     * @return future completed with the evaluation result
     */
    public CompletableFuture<EvaluationResult> schedule(AlertSignals signals, Map<String, Object> context) {
        try {
            return CompletableFuture.supplyAsync(() -> evaluate(signals, context), executor);
        } catch (RejectedExecutionException e) {
            dispatchRejectedCounter.increment();
            LOG.warnf("Alert dispatch executor rejected evaluation of %s: %s", signals, e.getMessage());
            return CompletableFuture.completedFuture(evaluate(signals, context, false));
        }
    }

    /**
     * Schedules an evaluation with signals above the default thresholds.
     */
    public CompletableFuture<EvaluationResult> sendTestAlert() {
        return schedule(TEST_SIGNALS, Map.of("source", "manual_test"));
    }

    private DeliveryResult deliverWebhook(URI target, AlertPayload payload) {
        if (target == null) {
            return DeliveryResult.skipped("no webhook target configured");
        }
        try {
            return webhookClient.post(target, payload);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Webhook delivery to %s failed", target);
            return DeliveryResult.failed(null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void notifySecondary(String address, AlertPayload payload) {
        if (address == null) {
            return;
        }
        try {
            DeliveryResult result = notifier.send(address, payload);
            if (!result.isDelivered()) {
                LOG.warnf("Alert notification to %s not delivered: %s", address, result.reason());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Alert notification to %s failed", address);
        }
    }

    private void publish(AlertPayload payload) {
        try {
            eventSink.alertFired(payload);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Event sink rejected alert notification");
        }
    }

    private static URI parseWebhookTarget(String value) {
        URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid parameter 'webhookTarget': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw ValidationException.invalidParameter("webhookTarget", value, "absolute http(s) URL");
        }
        return uri;
    }

    private static String validateNotifyAddress(String value) {
        String address = value.trim();
        if (address.isEmpty() || address.chars().anyMatch(Character::isWhitespace)
                || address.indexOf('@') <= 0 || address.endsWith("@")) {
            throw ValidationException.invalidParameter("notifyAddress", value, "an address like name@example.org");
        }
        return address;
    }

    private static void validateThreshold(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw ValidationException.invalidParameter(name, value, "finite non-negative number");
        }
    }
}
