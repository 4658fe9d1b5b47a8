/* (C)2026 */
package com.ammann.regimeshift.dto;

import com.ammann.regimeshift.model.AlertConfig;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Envelope returned by the subscription and status endpoints.
 */
@Schema(description = "Current alert configuration")
public record AlertConfigResponseDTO(boolean success, AlertConfig config) {

    public static AlertConfigResponseDTO of(AlertConfig config) {
        return new AlertConfigResponseDTO(true, config);
    }
}
