/* (C)2026 */
package com.ammann.regimeshift.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.regimeshift.enumeration.DeliveryOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlertModelTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void thresholdsUseOrSemanticsInclusive() {
        AlertThresholds thresholds = new AlertThresholds(0.5, 0.8);

        assertThat(thresholds.isExceededBy(new AlertSignals(0.5, 0.0))).isTrue();
        assertThat(thresholds.isExceededBy(new AlertSignals(0.0, 0.8))).isTrue();
        assertThat(thresholds.isExceededBy(new AlertSignals(0.49, 0.79))).isFalse();
    }

    @Test
    void mergeKeepsOmittedThresholds() {
        AlertThresholds current = new AlertThresholds(0.4, 0.6);

        assertThat(current.merge(0.9, null)).isEqualTo(new AlertThresholds(0.9, 0.6));
        assertThat(current.merge(null, 0.1)).isEqualTo(new AlertThresholds(0.4, 0.1));
        assertThat(current.merge(null, null)).isEqualTo(current);
    }

    @Test
    void payloadContextIsDetachedAndReadOnly() {
        Map<String, Object> context = new HashMap<>();
        context.put("species", "Owl");

        AlertPayload payload = AlertPayload.create(
                Instant.parse("2024-06-01T10:15:30Z"), new AlertSignals(1, 1), AlertThresholds.defaults(), context);
        context.clear();

        assertThat(payload.context()).containsEntry("species", "Owl");
        assertThatThrownBy(() -> payload.context().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(AlertPayload.create(Instant.EPOCH, new AlertSignals(1, 1), AlertThresholds.defaults(), null)
                        .context())
                .isEmpty();
    }

    @Test
    void configWithersKeepOtherFields() {
        TriggerRecord trigger = new TriggerRecord(Instant.EPOCH, DeliveryResult.skipped("none"), new AlertSignals(1, 1));
        AlertConfig config = AlertConfig.initial(AlertThresholds.defaults())
                .withWebhookTarget(URI.create("https://hooks.example.org/x"))
                .withLastTrigger(trigger)
                .withNotifyAddress("ops@example.org");

        assertThat(config.webhookTarget()).isEqualTo(URI.create("https://hooks.example.org/x"));
        assertThat(config.lastTrigger()).isEqualTo(trigger);
        assertThat(config.thresholds()).isEqualTo(AlertThresholds.defaults());
    }

    @Test
    void deliveryResultOmitsNullFieldsInJson() throws Exception {
        JsonNode delivered = objectMapper.valueToTree(DeliveryResult.delivered(null));
        JsonNode failed = objectMapper.valueToTree(DeliveryResult.failed(503, "HTTP 503"));

        assertThat(delivered.get("outcome").asText()).isEqualTo(DeliveryOutcome.DELIVERED.name());
        assertThat(delivered.has("statusCode")).isFalse();
        assertThat(delivered.has("reason")).isFalse();
        assertThat(failed.get("statusCode").asInt()).isEqualTo(503);
        assertThat(failed.get("reason").asText()).isEqualTo("HTTP 503");
    }

    @Test
    void snapshotFreshnessAndTotals() {
        Instant built = Instant.parse("2024-05-01T08:00:00Z");
        TimeSeriesSnapshot snapshot = new TimeSeriesSnapshot(
                Map.of("Owl", List.of(new DailyCount(LocalDate.of(2024, 3, 1), 4L),
                        new DailyCount(LocalDate.of(2024, 3, 2), 0L))),
                built);

        assertThat(TimeSeriesSnapshot.UNBUILT.isBuilt()).isFalse();
        assertThat(TimeSeriesSnapshot.UNBUILT.isFresh(built, Duration.ofHours(1))).isFalse();
        assertThat(snapshot.isFresh(built.plusSeconds(599), Duration.ofMinutes(10))).isTrue();
        assertThat(snapshot.isFresh(built.plusSeconds(600), Duration.ofMinutes(10))).isFalse();
        assertThat(snapshot.totalDetections()).isEqualTo(4L);
    }

    @Test
    void latestOfEmptySeriesIsAbsent() {
        assertThat(MetricSeries.empty("Owl").latest()).isEmpty();
        assertThat(MetricSeries.empty("Owl").isEmpty()).isTrue();
    }
}
