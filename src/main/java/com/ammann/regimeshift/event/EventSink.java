/* (C)2026 */
package com.ammann.regimeshift.event;

import com.ammann.regimeshift.model.AlertPayload;
import com.ammann.regimeshift.model.MetricSnapshot;

/**
 * Fire-and-forget receiver of progress and alert notifications, e.g. a push channel to dashboards.
 *
 * <p>Publishing is best effort: callers do not wait for acknowledgement and treat failures as
 * non-fatal.
 */
public interface EventSink {

    void alertFired(AlertPayload payload);

    void metricSnapshot(String species, MetricSnapshot snapshot);
}
