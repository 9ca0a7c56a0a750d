package com.simdash.dashboard.metrics;

import java.time.Instant;

/**
 * No-op metrics implementation.
 * Used for tests or when metrics collection is disabled.
 */
public class NoOpMetrics implements Metrics {

    /* -------- Ingestion -------- */

    @Override
    public void onBatchReceived(int size) {
        // no-op
    }

    @Override
    public void onEventAccepted() {
        // no-op
    }

    @Override
    public void onEventIgnored() {
        // no-op
    }

    @Override
    public void onEventMalformed() {
        // no-op
    }

    @Override
    public void onEventOutOfOrder() {
        // no-op
    }

    /* -------- State -------- */

    @Override
    public void onRetainedPointsUpdated(long retained) {
        // no-op
    }

    /* -------- Rendering -------- */

    @Override
    public void onRenderPublished() {
        // no-op
    }

    @Override
    public void onRenderSkipped() {
        // no-op
    }

    @Override
    public void onRenderFailed() {
        // no-op
    }

    /* -------- Snapshot -------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                0,          // batchesReceived
                0,          // eventsReceived
                0,          // eventsAccepted
                0,          // eventsIgnored
                0,          // eventsMalformed
                0,          // eventsOutOfOrder
                0,          // retainedPoints
                0,          // rendersPublished
                0,          // rendersSkipped
                0,          // rendersFailed
                0,          // sourceQueueDepth
                0,          // sourceEventsProcessed
                0,          // sourceOverflow
                Instant.now()
        );
    }
}
