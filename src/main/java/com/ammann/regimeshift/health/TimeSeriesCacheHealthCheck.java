/* (C)2026 */
package com.ammann.regimeshift.health;

import com.ammann.regimeshift.model.TimeSeriesSnapshot;
import com.ammann.regimeshift.service.TimeSeriesBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports the state of the time series cache.
 *
 * <p>Always UP: an unbuilt or empty cache is a normal state, not a failure. The data section
 * tells the two apart:
 * <ul>
 *   <li>NOT_BUILT: no request has needed the series yet</li>
 *   <li>EMPTY: built, but the detection source had no events</li>
 *   <li>READY: built with at least one species</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class TimeSeriesCacheHealthCheck implements HealthCheck {

    @Inject TimeSeriesBuilder timeSeriesBuilder;

    @Inject Clock clock;

    @Override
    public HealthCheckResponse call() {
        TimeSeriesSnapshot snapshot = timeSeriesBuilder.snapshot();

        String state;
        if (!snapshot.isBuilt()) {
            state = "NOT_BUILT";
        } else {
            state = snapshot.data().isEmpty() ? "EMPTY" : "READY";
        }

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("time-series-cache")
                .up()
                .withData("state", state)
                .withData("species", snapshot.data().size())
                .withData("fresh", snapshot.isFresh(clock.instant(), timeSeriesBuilder.ttl()));
        if (snapshot.isBuilt()) {
            builder.withData("built-at", snapshot.builtAt().toString());
        }
        return builder.build();
    }
}
