package com.simdash.dashboard.scenarios;

import com.simdash.dashboard.config.PipelineSettings;
import com.simdash.dashboard.config.TimestampPolicy;
import com.simdash.dashboard.engine.DashboardPipeline;
import com.simdash.dashboard.render.InMemoryRenderConsumer;
import com.simdash.dashboard.render.RenderSnapshot;
import com.simdash.dashboard.source.InMemoryEventBus;
import com.simdash.dashboard.testutil.TestFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.simdash.dashboard.testutil.TestFactory.event;
import static com.simdash.dashboard.testutil.TestFactory.ramp;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Producer publishes on the bus, the bus dispatches batches, the scheduled
 * render tick publishes snapshots.
 */
public class TestEndToEndDelivery {

    private final ThreadPoolTaskScheduler scheduler = TestFactory.newScheduler();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void testEventsFlowFromBusToSnapshot() throws Exception {
        InMemoryEventBus bus = new InMemoryEventBus(10_000, 100);
        InMemoryRenderConsumer consumer = new InMemoryRenderConsumer();
        DashboardPipeline pipeline = TestFactory.createPipeline(
                consumer,
                PipelineSettings.of(List.of("queue", "busy"), 10, 1000, 500, TimestampPolicy.TRUST),
                bus,
                scheduler
        );
        pipeline.start();
        try {
            consumer.expect(1);
            bus.publish(event("queue", 0, 2));
            bus.publish(event("ignored", 1, 99));
            bus.publish(event("queue", 4, 6));
            bus.drain();

            assertThat(consumer.await(2, TimeUnit.SECONDS)).isTrue();
            RenderSnapshot snapshot = consumer.last();
            assertThat(snapshot.totalEvents()).isEqualTo(2);
            assertThat(snapshot.perKey().get("queue").timeWeightedAverage()).isEqualTo(2.0);
            assertThat(snapshot.perKey().get("queue").currentValue()).isEqualTo(6.0);
            assertThat(snapshot.perKey().get("busy").currentValue()).isNull();
            assertThat(bus.totalEventsProcessed()).isEqualTo(3);
        } finally {
            pipeline.shutdown();
        }
    }

    /**
     * A burst far larger than one tick is coalesced: the render rate does not
     * follow the event rate, and the retained history stays capped.
     */
    @Test
    void testBurstIsCoalescedAndBounded() throws Exception {
        InMemoryEventBus bus = new InMemoryEventBus(10_000, 1000);
        InMemoryRenderConsumer consumer = new InMemoryRenderConsumer();
        DashboardPipeline pipeline = TestFactory.createPipeline(
                consumer,
                PipelineSettings.of(List.of("k"), 10, 1000, 500, TimestampPolicy.TRUST),
                bus,
                scheduler
        );
        pipeline.start();
        try {
            assertThat(bus.publishAll(ramp("k", 5000))).isEqualTo(5000);
            bus.drain();

            long deadline = System.currentTimeMillis() + 2000;
            while (System.currentTimeMillis() < deadline
                    && (consumer.snapshots().isEmpty() || consumer.last().totalEvents() < 5000)) {
                Thread.sleep(10);
            }

            RenderSnapshot last = consumer.last();
            assertThat(last.totalEvents()).isEqualTo(5000);
            assertThat(consumer.snapshots().size()).isLessThan(5000);
            assertThat(last.perKey().get("k").retainedPoints()).isEqualTo(1000);
            assertThat(last.perKey().get("k").downsampledPoints()).hasSizeLessThanOrEqualTo(500);
            assertThat(last.perKey().get("k").currentValue()).isEqualTo(4999.0);
            assertThat(last.globalRanges().minTime()).isEqualTo(0.0);
            assertThat(last.globalRanges().maxTime()).isEqualTo(4999.0);
        } finally {
            pipeline.shutdown();
        }
    }
}
