package com.simdash.dashboard.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simdash.dashboard.model.AxisRanges;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable frame handed to the render consumer.
 *
 * This is a READ MODEL:
 * - No logic
 * - Per-key entries follow the configured key order
 * - globalRanges is null until the first point arrives
 */
public record RenderSnapshot(

        @JsonProperty("sequence") long sequence,
        @JsonProperty("rendered_at") Instant renderedAt,

        /* -------- Series -------- */
        @JsonProperty("per_key") Map<String, SeriesView> perKey,
        @JsonProperty("global_ranges") AxisRanges globalRanges,
        @JsonProperty("plottable") boolean plottable,

        /* -------- Counters -------- */
        @JsonProperty("total_events") long totalEvents,
        @JsonProperty("events_since_last_tick") long eventsSinceLastTick,
        @JsonProperty("millis_since_last_render") long millisSinceLastRender,

        /* -------- Source status -------- */
        @JsonProperty("source_queue_depth") int sourceQueueDepth,
        @JsonProperty("source_events_processed") long sourceEventsProcessed
) {}
