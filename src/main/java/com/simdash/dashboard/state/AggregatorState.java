package com.simdash.dashboard.state;

/**
 * Running time-weighted statistic of one key.
 *
 * The signal is piecewise constant: each value holds until the next event.
 */
final class AggregatorState {

    private double lastTime;
    private double lastValue;
    private double weightedSum;
    private double totalDuration;

    AggregatorState(double firstTime, double firstValue) {
        this.lastTime = firstTime;
        this.lastValue = firstValue;
    }

    void add(double time, double value) {
        double duration = time - lastTime;
        weightedSum += lastValue * duration;
        totalDuration += duration;
        lastTime = time;
        lastValue = value;
    }

    double average() {
        return totalDuration > 0 ? weightedSum / totalDuration : lastValue;
    }

    double lastTime() {
        return lastTime;
    }

    double weightedSum() {
        return weightedSum;
    }

    double totalDuration() {
        return totalDuration;
    }
}
