/* (C)2026 */
package com.ammann.regimeshift.event;

import com.ammann.regimeshift.model.AlertPayload;
import com.ammann.regimeshift.model.MetricSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Default event sink that writes every notification to the application log.
 */
@ApplicationScoped
public class LoggingEventSink implements EventSink {

    private static final Logger LOG = Logger.getLogger(LoggingEventSink.class);

    @Override
    public void alertFired(AlertPayload payload) {
        LOG.infof("Alert fired at %s: variance=%.4f, autocorrelation=%.4f, context=%s",
                payload.timestamp(),
                payload.signals().variance(),
                payload.signals().autocorrelation(),
                payload.context());
    }

    @Override
    public void metricSnapshot(String species, MetricSnapshot snapshot) {
        LOG.infof("Signals for %s on %s: detections=%.0f, ac=%.3f, var=%.3f, trend=%.3f, risk=%.1f",
                species,
                snapshot.date(),
                snapshot.detections(),
                snapshot.autocorrelation(),
                snapshot.variance(),
                snapshot.trend(),
                snapshot.risk());
    }
}
