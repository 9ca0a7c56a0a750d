package com.simdash.dashboard.render;

import com.simdash.dashboard.model.SeriesPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reduces a series to at most {@code target} points for drawing.
 * <p>
 * Points are picked at a fixed stride {@code ceil(count / target)} starting at
 * the oldest point. The newest point is always kept so the trace ends at the
 * current value; if the stride already reached the target it takes the place of
 * the last picked point.
 * <p>
 * Picked points are joined as a step function: a horizontal segment at the
 * previous value up to the next point's time, then a vertical segment to its
 * value. A monitored quantity holds its value until the next change, so a
 * straight line between samples would misrepresent it.
 * <p>
 * Stateless and deterministic.
 */
@Component
public class StepDownsampler {

    public DownsampledSeries downsample(List<SeriesPoint> points, int target) {
        if (target < 2) {
            throw new IllegalArgumentException("target must be >= 2, was " + target);
        }
        if (points == null || points.isEmpty()) {
            return DownsampledSeries.EMPTY;
        }
        List<SeriesPoint> markers = select(points, target);
        return new DownsampledSeries(markers, stepPath(markers));
    }

    static int stride(int count, int target) {
        if (count <= target) {
            return 1;
        }
        return Math.max(1, (count + target - 1) / target);
    }

    private static List<SeriesPoint> select(List<SeriesPoint> points, int target) {
        int count = points.size();
        if (count <= target) {
            return List.copyOf(points);
        }
        int stride = stride(count, target);
        List<SeriesPoint> selected = new ArrayList<>(target);
        int lastPicked = -1;
        for (int i = 0; i < count; i += stride) {
            selected.add(points.get(i));
            lastPicked = i;
        }
        if (lastPicked != count - 1) {
            SeriesPoint newest = points.get(count - 1);
            if (selected.size() < target) {
                selected.add(newest);
            } else {
                selected.set(selected.size() - 1, newest);
            }
        }
        return Collections.unmodifiableList(selected);
    }

    private static List<SeriesPoint> stepPath(List<SeriesPoint> markers) {
        List<SeriesPoint> path = new ArrayList<>(markers.size() * 2);
        SeriesPoint previous = null;
        for (SeriesPoint marker : markers) {
            if (previous != null) {
                // hold the previous value until this change
                path.add(new SeriesPoint(marker.timestamp(), previous.value()));
            }
            path.add(marker);
            previous = marker;
        }
        return Collections.unmodifiableList(path);
    }
}
