/* (C)2026 */
package com.ammann.regimeshift.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check of the monitor process. Always UP; reports when the process started.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck
{
    private final Clock clock;
    private final Instant startedAt;

    @Inject
    public LivenessCheck(Clock clock)
    {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("regime-shift-monitor")
                .up()
                .withData("started-at", startedAt.toString())
                .withData("uptime-seconds", Duration.between(startedAt, clock.instant()).toSeconds())
                .build();
    }
}
