package com.simdash.dashboard.render;

import com.simdash.dashboard.model.AxisRanges;
import com.simdash.dashboard.model.SeriesPoint;

import java.util.List;

/**
 * Minimal copy of pipeline state taken under the pipeline lock.
 * Downsampling and assembly happen later, outside the lock.
 */
public record CapturedFrame(
        List<CapturedSeries> series,
        AxisRanges ranges,
        long totalEvents,
        long eventsSinceLastTick
) {

    /**
     * @param points  retained points, oldest first
     * @param average time-weighted average, null when the key has no data
     */
    public record CapturedSeries(String key, List<SeriesPoint> points, Double average) {}
}
