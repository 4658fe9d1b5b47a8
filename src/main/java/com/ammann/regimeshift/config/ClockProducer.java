/* (C)2026 */
package com.ammann.regimeshift.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Produces the system UTC clock so time-dependent beans (cache freshness, trigger timestamps)
 * can be driven by a fixed clock in tests.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
