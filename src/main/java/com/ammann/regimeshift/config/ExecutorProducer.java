/* (C)2026 */
package com.ammann.regimeshift.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named executors of the application.
 *
 * <p>Provides the "alert-dispatch-executor" bean used by
 * {@link com.ammann.regimeshift.service.AlertEvaluator} to run alert evaluation and webhook
 * delivery outside of the request that scheduled it.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String ALERT_DISPATCH_EXECUTOR = "alert-dispatch-executor";

    /**
     * Produces a bounded ManagedExecutor for alert dispatch. Webhook calls are I/O bound and
     * carry their own timeout, so two workers are enough; excess evaluations queue.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(ALERT_DISPATCH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createAlertDispatchExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(2)
                .maxQueued(50)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
