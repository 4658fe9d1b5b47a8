/* (C)2026 */
package com.ammann.regimeshift.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(
                ValidationException.invalidParameter("webhookTarget", "ftp://x", "absolute http(s) URL"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message).contains("webhookTarget");
        assertThat(body.status).isEqualTo(400);
        assertThat(body.timestamp).isNotNull();
    }

    @Test
    void includesRequestPathWhenAvailable()
    {
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/v1/alerts/subscribe");
        handler.uriInfo = uriInfo;

        Response response = handler.toResponse(new ValidationException("bad input"));

        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isEqualTo("/api/v1/alerts/subscribe");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("No detections for species 'Owl'"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
        assertThat(body.message).contains("Owl");
    }

    @Test
    void keepsStatusOfOtherWebApplicationExceptions()
    {
        Response response = handler.toResponse(new BadRequestException("malformed JSON"));

        assertThat(response.getStatus()).isEqualTo(400);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("REQUEST_ERROR");
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new IllegalStateException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).isEqualTo("An unexpected error occurred");
    }

    @Test
    void invalidParameterMessageNamesParameterAndExpectation()
    {
        ValidationException e = ValidationException.invalidParameter("limit", 0, "positive integer");

        assertThat(e).hasMessage("Invalid parameter 'limit': got '0', expected positive integer");
    }

    @Test
    void outOfRangeMessageNamesBounds()
    {
        ValidationException e = ValidationException.outOfRange("metricWindow", 400, 1, 365);

        assertThat(e).hasMessage("Parameter 'metricWindow' must be between 1 and 365, got 400");
    }
}
