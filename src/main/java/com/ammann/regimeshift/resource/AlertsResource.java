/* (C)2026 */
package com.ammann.regimeshift.resource;

import com.ammann.regimeshift.dto.AlertConfigResponseDTO;
import com.ammann.regimeshift.dto.AlertEvaluationRequestDTO;
import com.ammann.regimeshift.dto.AlertSubscriptionRequestDTO;
import com.ammann.regimeshift.dto.EvaluationScheduledResponseDTO;
import com.ammann.regimeshift.dto.ThresholdsDTO;
import com.ammann.regimeshift.exception.ValidationException;
import com.ammann.regimeshift.model.AlertConfig;
import com.ammann.regimeshift.model.AlertSignals;
import com.ammann.regimeshift.model.EvaluationResult;
import com.ammann.regimeshift.properties.ApiProperties;
import com.ammann.regimeshift.service.AlertEvaluator;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for alert subscription, status and evaluation.
 *
 * <p>Evaluation requests are acknowledged immediately; the evaluation and any webhook delivery
 * run in the background.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Alerts.BASE)
@Tag(name = "Alerts API", description = "Early-warning alert subscription and evaluation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AlertsResource {

    private static final Logger LOG = Logger.getLogger(AlertsResource.class);

    @Inject AlertEvaluator alertEvaluator;

    @POST
    @Path(ApiProperties.Alerts.SUBSCRIBE)
    @Operation(
            summary = "Update alert subscription",
            description = "Merges the supplied webhook target, notify address and thresholds into the"
                    + " current configuration. Omitted fields are left unchanged.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Subscription updated"),
        @APIResponse(responseCode = "400", description = "Malformed URL, address or threshold")
    })
    public Response subscribe(AlertSubscriptionRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Subscription body is required");
        }
        ThresholdsDTO thresholds = request.thresholds();
        AlertConfig updated = alertEvaluator.subscribe(
                request.webhookTarget(),
                request.notifyAddress(),
                thresholds != null ? thresholds.variance() : null,
                thresholds != null ? thresholds.autocorrelation() : null);
        return Response.ok(AlertConfigResponseDTO.of(updated)).build();
    }

    @GET
    @Path(ApiProperties.Alerts.STATUS)
    @Operation(summary = "Alert status", description = "Returns the alert configuration and the last trigger")
    public Response status() {
        return Response.ok(AlertConfigResponseDTO.of(alertEvaluator.status())).build();
    }

    @POST
    @Path(ApiProperties.Alerts.EVALUATE)
    @Operation(
            summary = "Evaluate signals",
            description = "Schedules evaluation of the given variance and autocorrelation against the"
                    + " thresholds. Returns once scheduled, not once evaluated.")
    @APIResponses({
        @APIResponse(responseCode = "202", description = "Evaluation scheduled"),
        @APIResponse(responseCode = "400", description = "Missing or non-finite signal values")
    })
    public Response evaluate(AlertEvaluationRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Evaluation body is required");
        }
        requireFinite("variance", request.variance());
        requireFinite("autocorrelation", request.autocorrelation());

        AlertSignals signals = new AlertSignals(request.variance(), request.autocorrelation());
        Map<String, Object> context = request.context() != null ? request.context() : Map.of();

        LOG.debugf("Scheduling alert evaluation for %s", signals);
        logFailures(alertEvaluator.schedule(signals, context));
        return Response.accepted(EvaluationScheduledResponseDTO.accepted()).build();
    }

    @POST
    @Path(ApiProperties.Alerts.TEST)
    @Operation(summary = "Send test alert", description = "Schedules an evaluation that crosses the default thresholds")
    public Response sendTestAlert() {
        LOG.info("Manual test alert requested");
        logFailures(alertEvaluator.sendTestAlert());
        return Response.accepted(EvaluationScheduledResponseDTO.accepted()).build();
    }

    private static void requireFinite(String name, Double value) {
        if (value == null || !Double.isFinite(value)) {
            throw ValidationException.invalidParameter(name, value, "finite number");
        }
    }

    private static void logFailures(CompletableFuture<EvaluationResult> evaluation) {
        evaluation.whenComplete((result, error) -> {
            if (error != null) {
                LOG.errorf(error, "Background alert evaluation failed");
            }
        });
    }
}
