/* (C)2026 */
package com.ammann.regimeshift.service;

import com.ammann.regimeshift.model.AlertConfig;
import com.ammann.regimeshift.model.AlertThresholds;
import com.ammann.regimeshift.model.TriggerRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Holder of the alert configuration of this process.
 *
 * <p>The configuration is an immutable {@link AlertConfig} swapped atomically, so a subscription
 * and a trigger record written at the same time never lose each other's fields. State lives only
 * as long as the process.
 */
@ApplicationScoped
public class AlertConfigStore {

    private final AtomicReference<AlertConfig> config;

    @Inject
    public AlertConfigStore(
            @ConfigProperty(name = "regime.alerts.default-variance", defaultValue = "0.7") double variance,
            @ConfigProperty(name = "regime.alerts.default-autocorrelation", defaultValue = "0.7")
                    double autocorrelation) {
        this(new AlertThresholds(variance, autocorrelation));
    }

    public AlertConfigStore(AlertThresholds initialThresholds) {
        this.config = new AtomicReference<>(AlertConfig.initial(initialThresholds));
    }

    public AlertConfig current() {
        return config.get();
    }

    /**
     * Applies {@code change} atomically and returns the resulting configuration.
     */
    public AlertConfig update(UnaryOperator<AlertConfig> change) {
        return config.updateAndGet(change);
    }

    public AlertConfig recordTrigger(TriggerRecord trigger) {
        return update(c -> c.withLastTrigger(trigger));
    }
}
