package com.simdash.dashboard.state;

import java.util.HashMap;
import java.util.Map;

/**
 * Incremental time-weighted average per key.
 * <p>
 * Each call to {@link #addEvent(String, double, double)} closes the interval
 * opened by the previous event of the same key, weighting the previous value
 * by the elapsed time. The first event of a key only opens an interval.
 * <p>
 * Caller contract: timestamps per key are non-decreasing. This class does not
 * check it; a regression contributes a negative duration and skews the average.
 * <p>
 * Not thread-safe; guarded by the owning pipeline's lock.
 */
public class TimeWeightedAggregator {

    /**
     * Returned by {@link #average(String)} for a key that has seen no events.
     */
    public static final double NO_DATA_AVERAGE = 0.0;

    private final Map<String, AggregatorState> states = new HashMap<>();

    public void addEvent(String key, double time, double value) {
        AggregatorState state = states.get(key);
        if (state == null) {
            states.put(key, new AggregatorState(time, value));
            return;
        }
        state.add(time, value);
    }

    /**
     * Time-weighted average of the key's signal so far.
     * <ul>
     *   <li>{@code weightedSum / totalDuration} once some time has elapsed</li>
     *   <li>the last value while total duration is zero (e.g. a single event)</li>
     *   <li>{@link #NO_DATA_AVERAGE} for an unknown key</li>
     * </ul>
     */
    public double average(String key) {
        AggregatorState state = states.get(key);
        return state == null ? NO_DATA_AVERAGE : state.average();
    }

    /**
     * Timestamp of the key's latest event, or NaN for an unknown key.
     */
    public double lastTime(String key) {
        AggregatorState state = states.get(key);
        return state == null ? Double.NaN : state.lastTime();
    }

    public double totalDuration(String key) {
        AggregatorState state = states.get(key);
        return state == null ? 0.0 : state.totalDuration();
    }

    public boolean hasKey(String key) {
        return states.containsKey(key);
    }

    public int keyCount() {
        return states.size();
    }

    public void clear() {
        states.clear();
    }
}
