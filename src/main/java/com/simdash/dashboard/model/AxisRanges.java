package com.simdash.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Global time/value extent over every point ever appended.
 *
 * The extent only widens; evicting points never narrows it.
 */
public record AxisRanges(
        @JsonProperty("min_time") double minTime,
        @JsonProperty("max_time") double maxTime,
        @JsonProperty("min_value") double minValue,
        @JsonProperty("max_value") double maxValue
) {

    /**
     * A chart needs a non-zero time span to lay out its x-axis.
     */
    @JsonIgnore
    public boolean hasTimeSpan() {
        return maxTime > minTime;
    }
}
