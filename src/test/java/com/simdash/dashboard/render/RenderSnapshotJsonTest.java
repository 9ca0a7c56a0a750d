package com.simdash.dashboard.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simdash.dashboard.config.DashboardConfig;
import com.simdash.dashboard.model.AxisRanges;
import com.simdash.dashboard.model.SeriesPoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class RenderSnapshotJsonTest {

    private final ObjectMapper objectMapper = new DashboardConfig().objectMapper();

    @Test
    void testSnapshotUsesSnakeCaseFields() throws Exception {
        Map<String, SeriesView> perKey = new LinkedHashMap<>();
        perKey.put("Server1.Capacity.Allocated", new SeriesView(
                2.0, 1.5, 2,
                List.of(new SeriesPoint(0, 1), new SeriesPoint(4, 2)),
                List.of(new SeriesPoint(0, 1), new SeriesPoint(4, 1), new SeriesPoint(4, 2)),
                "#FF0000"));
        perKey.put("Idle", new SeriesView(null, null, 0, List.of(), List.of(), "#0000FF"));

        RenderSnapshot snapshot = new RenderSnapshot(
                7,
                Instant.parse("2026-01-24T12:00:00Z"),
                perKey,
                new AxisRanges(0, 4, 1, 2),
                true,
                2,
                2,
                50,
                0,
                2
        );

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(snapshot));

        assertThat(json.get("sequence").asLong()).isEqualTo(7);
        assertThat(json.get("rendered_at").asText()).isEqualTo("2026-01-24T12:00:00Z");
        assertThat(json.get("global_ranges").get("max_time").asDouble()).isEqualTo(4.0);
        assertThat(json.get("global_ranges").has("time_span")).isFalse();
        assertThat(json.get("events_since_last_tick").asLong()).isEqualTo(2);

        JsonNode series = json.get("per_key").get("Server1.Capacity.Allocated");
        assertThat(series.get("current_value").asDouble()).isEqualTo(2.0);
        assertThat(series.get("time_weighted_average").asDouble()).isEqualTo(1.5);
        assertThat(series.get("step_path")).hasSize(3);
        assertThat(series.get("downsampled_points").get(1).get("timestamp").asDouble()).isEqualTo(4.0);

        assertThat(json.get("per_key").get("Idle").get("current_value").isNull()).isTrue();
    }

    @Test
    void testEmptyStartHasNullRanges() throws Exception {
        RenderSnapshot snapshot = new RenderSnapshot(
                1, Instant.parse("2026-01-24T12:00:00Z"), Map.of(), null, false, 0, 0, 0, 0, 0);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(snapshot));

        assertThat(json.get("global_ranges").isNull()).isTrue();
        assertThat(json.get("plottable").asBoolean()).isFalse();
    }
}
