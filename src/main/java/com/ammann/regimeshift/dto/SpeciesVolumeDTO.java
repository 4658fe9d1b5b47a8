/* (C)2026 */
package com.ammann.regimeshift.dto;

import com.ammann.regimeshift.model.DailyCount;
import java.time.LocalDate;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Detection volume of one species")
public record SpeciesVolumeDTO(
        @Schema(description = "Species label") String species,
        @Schema(description = "Total detections over the whole series") long totalDetections,
        @Schema(description = "Number of days covered, including days without detections") int days,
        @Schema(description = "First day of the series") LocalDate firstDay,
        @Schema(description = "Last day of the series") LocalDate lastDay) {

    public static SpeciesVolumeDTO from(String species, List<DailyCount> series) {
        long total = series.stream().mapToLong(DailyCount::count).sum();
        return new SpeciesVolumeDTO(
                species,
                total,
                series.size(),
                series.isEmpty() ? null : series.get(0).day(),
                series.isEmpty() ? null : series.get(series.size() - 1).day());
    }
}
