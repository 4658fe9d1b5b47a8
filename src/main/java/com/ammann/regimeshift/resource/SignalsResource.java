/* (C)2026 */
package com.ammann.regimeshift.resource;

import com.ammann.regimeshift.dto.CacheSummaryDTO;
import com.ammann.regimeshift.dto.SpeciesVolumeDTO;
import com.ammann.regimeshift.exception.ValidationException;
import com.ammann.regimeshift.model.DailyCount;
import com.ammann.regimeshift.model.MetricSeries;
import com.ammann.regimeshift.properties.ApiProperties;
import com.ammann.regimeshift.service.SignalEngine;
import com.ammann.regimeshift.service.TimeSeriesBuilder;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the early-warning metrics of the detection time series.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Signals.BASE)
@Tag(name = "Signals API", description = "Critical slowing down indicators per species")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SignalsResource {

    private static final Logger LOG = Logger.getLogger(SignalsResource.class);
    static final String ALL_SPECIES = "all";
    private static final int MAX_WINDOW = 365;
    private static final int MAX_SPECIES_LIMIT = 100;

    @Inject TimeSeriesBuilder timeSeriesBuilder;

    @Inject SignalEngine signalEngine;

    @ConfigProperty(name = "regime.metrics.trend-window", defaultValue = "14")
    int defaultTrendWindow = SignalEngine.DEFAULT_TREND_WINDOW;

    @ConfigProperty(name = "regime.metrics.metric-window", defaultValue = "14")
    int defaultMetricWindow = SignalEngine.DEFAULT_METRIC_WINDOW;

    @ConfigProperty(name = "regime.metrics.baseline", defaultValue = "30")
    int defaultBaseline = SignalEngine.DEFAULT_BASELINE;

    @GET
    @Path(ApiProperties.Signals.METRICS)
    @Operation(
            summary = "Early-warning metrics",
            description = "Returns autocorrelation, variance, trend and risk per day for one species,"
                    + " or for every species when species is 'all'")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Metrics keyed by species"),
        @APIResponse(responseCode = "400", description = "Invalid window or baseline"),
        @APIResponse(responseCode = "404", description = "Unknown species")
    })
    public Response getMetrics(
            @Parameter(description = "Species label or 'all'")
                    @QueryParam("species") @DefaultValue(ALL_SPECIES) String species,
            @Parameter(description = "Detrending window in days") @QueryParam("trendWindow") Integer trendWindow,
            @Parameter(description = "Metric window in days") @QueryParam("metricWindow") Integer metricWindow,
            @Parameter(description = "Baseline length in days") @QueryParam("baselineN") Integer baselineN) {

        int effectiveTrend = resolveWindow("trendWindow", trendWindow, defaultTrendWindow);
        int effectiveMetric = resolveWindow("metricWindow", metricWindow, defaultMetricWindow);
        int effectiveBaseline = resolveWindow("baselineN", baselineN, defaultBaseline);

        Map<String, List<DailyCount>> series = timeSeriesBuilder.getOrBuild(false);
        Map<String, MetricSeries> result = new LinkedHashMap<>();

        if (species == null || species.isBlank() || ALL_SPECIES.equalsIgnoreCase(species)) {
            series.forEach((name, days) -> result.put(name,
                    signalEngine.computeMetrics(name, days, effectiveTrend, effectiveMetric, effectiveBaseline)));
        } else {
            List<DailyCount> days = series.get(species);
            if (days == null) {
                throw new NotFoundException("No detections for species '" + species + "'");
            }
            result.put(species,
                    signalEngine.computeMetrics(species, days, effectiveTrend, effectiveMetric, effectiveBaseline));
        }

        LOG.debugf("Metrics computed for %d species (trend=%d, metric=%d, baseline=%d)",
                result.size(), effectiveTrend, effectiveMetric, effectiveBaseline);
        return Response.ok(result).build();
    }

    @GET
    @Path(ApiProperties.Signals.SPECIES)
    @Operation(summary = "Species by volume", description = "Returns species ranked by total detections")
    public Response getSpecies(@QueryParam("limit") @DefaultValue("5") int limit) {
        int effectiveLimit = Math.min(Math.max(1, limit), MAX_SPECIES_LIMIT);
        Map<String, List<DailyCount>> series = timeSeriesBuilder.getOrBuild(false);
        List<SpeciesVolumeDTO> ranked = timeSeriesBuilder.topSpeciesByVolume(effectiveLimit).stream()
                .map(name -> SpeciesVolumeDTO.from(name, series.getOrDefault(name, List.of())))
                .toList();
        return Response.ok(ranked).build();
    }

    @POST
    @Path(ApiProperties.Signals.REBUILD)
    @Operation(summary = "Rebuild time series", description = "Rescans the detection source, ignoring the cache TTL")
    public Response rebuild() {
        LOG.info("Forced time series rebuild requested");
        timeSeriesBuilder.getOrBuild(true);
        return Response.ok(CacheSummaryDTO.from(timeSeriesBuilder.snapshot())).build();
    }

    private static int resolveWindow(String name, Integer requested, int fallback) {
        if (requested == null) {
            return fallback;
        }
        if (requested <= 0 || requested > MAX_WINDOW) {
            throw ValidationException.outOfRange(name, requested, 1, MAX_WINDOW);
        }
        return requested;
    }
}
