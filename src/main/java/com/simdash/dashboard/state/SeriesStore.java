package com.simdash.dashboard.state;

import com.simdash.dashboard.model.AxisRanges;
import com.simdash.dashboard.model.SeriesPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded per-key history plus the global time/value extent.
 * <p>
 * Each key gets a ring buffer of {@code maxPoints} slots on its first point.
 * Once full, every append evicts the oldest point of that key.
 * <p>
 * The global extent is widened on every append and is never recomputed after
 * eviction: the axis range may cover points that are no longer retained.
 * <p>
 * Not thread-safe; guarded by the owning pipeline's lock.
 */
@Slf4j
public class SeriesStore {

    private final int maxPoints;

    /**
     * key -> history, in order of first observation
     */
    private final Map<String, SeriesRingBuffer> series = new LinkedHashMap<>();

    private double minTime = Double.POSITIVE_INFINITY;
    private double maxTime = Double.NEGATIVE_INFINITY;
    private double minValue = Double.POSITIVE_INFINITY;
    private double maxValue = Double.NEGATIVE_INFINITY;

    private long totalRetained;

    public SeriesStore(int maxPoints) {
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be >= 1, was " + maxPoints);
        }
        this.maxPoints = maxPoints;
    }

    /**
     * Append a point to a key's history, evicting the oldest point when the
     * key already holds {@code maxPoints}.
     */
    public void append(String key, SeriesPoint point) {
        SeriesRingBuffer buffer = series.computeIfAbsent(key, k -> {
            log.debug("Creating series for key {} (capacity {})", k, maxPoints);
            return new SeriesRingBuffer(maxPoints);
        });
        boolean evicted = buffer.append(point.timestamp(), point.value());
        if (!evicted) {
            totalRetained++;
        }

        minTime = Math.min(minTime, point.timestamp());
        maxTime = Math.max(maxTime, point.timestamp());
        minValue = Math.min(minValue, point.value());
        maxValue = Math.max(maxValue, point.value());
    }

    /**
     * Retained points for a key, oldest first. Returns a copy; never mutates state.
     *
     * @return empty list for a key with no points
     */
    public List<SeriesPoint> snapshot(String key) {
        SeriesRingBuffer buffer = series.get(key);
        return buffer == null ? List.of() : buffer.toList();
    }

    public Optional<SeriesPoint> last(String key) {
        SeriesRingBuffer buffer = series.get(key);
        return buffer == null ? Optional.empty() : Optional.ofNullable(buffer.last());
    }

    public int size(String key) {
        SeriesRingBuffer buffer = series.get(key);
        return buffer == null ? 0 : buffer.size();
    }

    public long totalRetainedPoints() {
        return totalRetained;
    }

    public Set<String> keys() {
        return Set.copyOf(series.keySet());
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    /**
     * @return the global extent, or null before the first point
     */
    public AxisRanges ranges() {
        if (minTime > maxTime) {
            return null;
        }
        return new AxisRanges(minTime, maxTime, minValue, maxValue);
    }

    /**
     * Drop every series and reset the extent to its sentinels.
     */
    public void clear() {
        series.clear();
        totalRetained = 0;
        minTime = Double.POSITIVE_INFINITY;
        maxTime = Double.NEGATIVE_INFINITY;
        minValue = Double.POSITIVE_INFINITY;
        maxValue = Double.NEGATIVE_INFINITY;
    }
}
