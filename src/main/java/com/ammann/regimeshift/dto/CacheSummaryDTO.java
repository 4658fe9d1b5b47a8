/* (C)2026 */
package com.ammann.regimeshift.dto;

import com.ammann.regimeshift.model.TimeSeriesSnapshot;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "State of the daily time series cache")
public record CacheSummaryDTO(
        @Schema(description = "When the cache was last built") Instant builtAt,
        @Schema(description = "Number of species with at least one detection") int speciesCount,
        @Schema(description = "Total detections across all species") long totalDetections) {

    public static CacheSummaryDTO from(TimeSeriesSnapshot snapshot) {
        return new CacheSummaryDTO(snapshot.builtAt(), snapshot.data().size(), snapshot.totalDetections());
    }
}
