package com.simdash.dashboard.render;

import com.simdash.dashboard.model.SeriesPoint;

import java.util.List;

/**
 * Render-ready reduction of one series.
 *
 * @param markers  selected points, oldest first
 * @param stepPath polyline vertices joining the markers with horizontal-then-vertical steps
 */
public record DownsampledSeries(List<SeriesPoint> markers, List<SeriesPoint> stepPath) {

    public static final DownsampledSeries EMPTY = new DownsampledSeries(List.of(), List.of());
}
