package com.simdash.dashboard.metrics;

/**
 * Lightweight metrics API used by the pipeline and render scheduler, exposed via /metrics.
 */
public interface Metrics {

    void onBatchReceived(int size);

    void onEventAccepted();

    void onEventIgnored();

    void onEventMalformed();

    void onEventOutOfOrder();

    void onRetainedPointsUpdated(long retained);

    void onRenderPublished();

    void onRenderSkipped();

    void onRenderFailed();

    MetricsSnapshot snapshot();
}
