/* (C)2026 */
package com.ammann.regimeshift.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Threshold fields of a subscription request. Either value may be omitted.
 */
@Schema(description = "Alert thresholds; omitted values keep their current setting")
public record ThresholdsDTO(
        @Schema(description = "Variance level that fires an alert") Double variance,
        @Schema(description = "Lag-1 autocorrelation level that fires an alert") Double autocorrelation) {}
