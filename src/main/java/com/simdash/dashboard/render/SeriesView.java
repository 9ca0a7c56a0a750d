package com.simdash.dashboard.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simdash.dashboard.model.SeriesPoint;

import java.util.List;

/**
 * Render state of one monitored key. Nulls mean the key has no data yet.
 */
public record SeriesView(
        @JsonProperty("current_value") Double currentValue,
        @JsonProperty("time_weighted_average") Double timeWeightedAverage,
        @JsonProperty("retained_points") int retainedPoints,
        @JsonProperty("downsampled_points") List<SeriesPoint> downsampledPoints,
        @JsonProperty("step_path") List<SeriesPoint> stepPath,
        @JsonProperty("color") String color
) {}
