/* (C)2026 */
package com.ammann.regimeshift.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Partial update of the alert subscription")
public record AlertSubscriptionRequestDTO(
        @Schema(description = "Webhook URL receiving alert POSTs", example = "https://hooks.example.org/alerts")
                String webhookTarget,
        @Schema(description = "Address for the secondary notification", example = "ops@example.org")
                String notifyAddress,
        @Schema(description = "New thresholds") ThresholdsDTO thresholds) {}
