/* (C)2026 */
package com.ammann.regimeshift.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Acknowledges that an evaluation was scheduled; it says nothing about its outcome.
 */
@Schema(description = "Evaluation scheduling acknowledgement")
public record EvaluationScheduledResponseDTO(boolean success, boolean scheduled) {

    public static EvaluationScheduledResponseDTO accepted() {
        return new EvaluationScheduledResponseDTO(true, true);
    }
}
