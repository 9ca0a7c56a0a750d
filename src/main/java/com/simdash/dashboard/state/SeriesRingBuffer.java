package com.simdash.dashboard.state;

import com.simdash.dashboard.model.SeriesPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity history of one series.
 *
 * Points are kept in two parallel primitive arrays indexed by a write cursor.
 * Appending to a full buffer overwrites the oldest slot, so append and evict
 * are both O(1). Not thread-safe.
 */
final class SeriesRingBuffer {

    private final double[] timestamps;
    private final double[] values;

    // next slot to write
    private int head;
    private int size;

    SeriesRingBuffer(int capacity) {
        this.timestamps = new double[capacity];
        this.values = new double[capacity];
    }

    /**
     * @return true if the append evicted the oldest point
     */
    boolean append(double timestamp, double value) {
        boolean evicted = size == timestamps.length;
        timestamps[head] = timestamp;
        values[head] = value;
        head = (head + 1) % timestamps.length;
        if (!evicted) {
            size++;
        }
        return evicted;
    }

    int size() {
        return size;
    }

    SeriesPoint last() {
        if (size == 0) {
            return null;
        }
        int idx = (head - 1 + timestamps.length) % timestamps.length;
        return new SeriesPoint(timestamps[idx], values[idx]);
    }

    /**
     * Copy of the retained points, oldest first.
     */
    List<SeriesPoint> toList() {
        List<SeriesPoint> out = new ArrayList<>(size);
        int start = (head - size + timestamps.length) % timestamps.length;
        for (int i = 0; i < size; i++) {
            int idx = (start + i) % timestamps.length;
            out.add(new SeriesPoint(timestamps[idx], values[idx]));
        }
        return out;
    }
}
