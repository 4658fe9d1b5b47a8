/* (C)2026 */
package com.ammann.regimeshift.scheduled;

import com.ammann.regimeshift.event.EventSink;
import com.ammann.regimeshift.model.DailyCount;
import com.ammann.regimeshift.model.MetricSeries;
import com.ammann.regimeshift.service.SignalEngine;
import com.ammann.regimeshift.service.TimeSeriesBuilder;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Periodically refreshes the time series and publishes the latest signals of the busiest species.
 * <p>
 * Runs every {@code regime.monitor.every} (10 minutes by default, the cache TTL), so each run
 * normally triggers one rebuild. Only the metrics of the most recent day are published to the
 * {@link EventSink}; the full series remain available through the signals endpoint.
 */
@ApplicationScoped
public class SignalMonitorService {

    private static final Logger LOG = Logger.getLogger(SignalMonitorService.class);

    @Inject TimeSeriesBuilder timeSeriesBuilder;

    @Inject SignalEngine signalEngine;

    @Inject EventSink eventSink;

    @ConfigProperty(name = "regime.monitor.enabled", defaultValue = "true")
    boolean enabled = true;

    @ConfigProperty(name = "regime.monitor.top-species", defaultValue = "5")
    int topSpecies = 5;

    @Scheduled(every = "{regime.monitor.every}", identity = "signal-monitor", delayed = "30s")
    public void publishLatestSignals() {
        if (!enabled) {
            return;
        }

        try {
            Map<String, List<DailyCount>> series = timeSeriesBuilder.getOrBuild(false);
            int published = 0;
            for (String species : timeSeriesBuilder.topSpeciesByVolume(topSpecies)) {
                MetricSeries metrics = signalEngine.computeMetrics(species, series.getOrDefault(species, List.of()));
                if (metrics.latest().isPresent()) {
                    eventSink.metricSnapshot(species, metrics.latest().get());
                    published++;
                }
            }
            LOG.debugf("Signal monitor published %d species snapshots", published);
        } catch (Exception e) {
            LOG.errorf(e, "Signal monitor run failed");
        }
    }
}
