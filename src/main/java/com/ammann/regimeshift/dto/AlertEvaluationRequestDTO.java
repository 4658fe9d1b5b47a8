/* (C)2026 */
package com.ammann.regimeshift.dto;

import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Signal values to evaluate against the alert thresholds")
public record AlertEvaluationRequestDTO(
        @Schema(description = "Current variance signal", required = true) Double variance,
        @Schema(description = "Current lag-1 autocorrelation signal", required = true) Double autocorrelation,
        @Schema(description = "Free-form context copied into the alert payload") Map<String, Object> context) {}
