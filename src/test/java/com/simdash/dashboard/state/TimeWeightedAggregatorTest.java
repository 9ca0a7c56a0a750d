package com.simdash.dashboard.state;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class TimeWeightedAggregatorTest {

    /**
     * Value 5 held from t=10 to t=20: weightedSum=50, totalDuration=10.
     */
    @Test
    void testAverageOfTwoEvents() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();

        aggregator.addEvent("k", 10, 5);
        aggregator.addEvent("k", 20, 10);

        assertThat(aggregator.average("k")).isEqualTo(5.0);
        assertThat(aggregator.totalDuration("k")).isEqualTo(10.0);
    }

    @Test
    void testSingleEventFallsBackToLastValue() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();

        aggregator.addEvent("k", 0, 7);

        assertThat(aggregator.average("k")).isEqualTo(7.0);
        assertThat(aggregator.totalDuration("k")).isZero();
    }

    @Test
    void testUnknownKeyReturnsDefault() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();

        assertThat(aggregator.average("missing")).isEqualTo(TimeWeightedAggregator.NO_DATA_AVERAGE);
        assertThat(aggregator.hasKey("missing")).isFalse();
        assertThat(aggregator.lastTime("missing")).isNaN();
    }

    /**
     * Step signal: 0 for 2 units, 10 for 6 units, 4 for 2 units -> (0*2 + 10*6 + 4*2) / 10 = 6.8
     */
    @Test
    void testStepSignalIntegral() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();

        aggregator.addEvent("queue", 0, 0);
        aggregator.addEvent("queue", 2, 10);
        aggregator.addEvent("queue", 8, 4);
        aggregator.addEvent("queue", 10, 100); // last value has no duration yet

        assertThat(aggregator.average("queue")).isCloseTo(6.8, within(1e-12));
    }

    /**
     * Several events at the same instant contribute nothing until time moves on.
     */
    @Test
    void testSimultaneousEventsKeepLatestValue() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();

        aggregator.addEvent("k", 3, 1);
        aggregator.addEvent("k", 3, 2);
        aggregator.addEvent("k", 3, 9);

        assertThat(aggregator.average("k")).isEqualTo(9.0);

        aggregator.addEvent("k", 5, 0);
        assertThat(aggregator.average("k")).isEqualTo(9.0);
    }

    @Test
    void testKeysAreIndependent() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();

        aggregator.addEvent("a", 0, 1);
        aggregator.addEvent("b", 0, 100);
        aggregator.addEvent("a", 10, 3);
        aggregator.addEvent("b", 5, 0);

        assertThat(aggregator.average("a")).isEqualTo(1.0);
        assertThat(aggregator.average("b")).isEqualTo(100.0);
        assertThat(aggregator.keyCount()).isEqualTo(2);
    }

    /**
     * Regressing timestamps are not rejected; the negative duration flows into the formula.
     */
    @Test
    void testRegressionIsNotValidated() {
        AggregatorState state = new AggregatorState(10, 5);

        state.add(20, 1);  // +50 over 10
        state.add(15, 3);  // -5 over -5

        assertThat(state.weightedSum()).isEqualTo(45.0);
        assertThat(state.totalDuration()).isEqualTo(5.0);
        assertThat(state.average()).isEqualTo(9.0);
    }

    @Test
    void testClearForgetsAllKeys() {
        TimeWeightedAggregator aggregator = new TimeWeightedAggregator();
        aggregator.addEvent("k", 0, 1);

        aggregator.clear();

        assertThat(aggregator.keyCount()).isZero();
        assertThat(aggregator.average("k")).isEqualTo(TimeWeightedAggregator.NO_DATA_AVERAGE);
    }
}
