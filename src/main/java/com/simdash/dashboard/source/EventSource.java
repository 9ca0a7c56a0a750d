package com.simdash.dashboard.source;

/**
 * Producer side of the ingestion boundary.
 */
public interface EventSource {

    /**
     * Register a consumer for batch delivery.
     *
     * @return handle whose {@link Subscription#close()} unsubscribes the consumer
     */
    Subscription subscribe(EventConsumer consumer);

    /**
     * Remove a consumer. Unknown or already removed consumers are ignored.
     * Once this returns the consumer receives no further batches.
     */
    void unsubscribe(EventConsumer consumer);

    /**
     * Events accepted but not yet delivered. Diagnostic only.
     */
    int queueDepth();

    /**
     * Events delivered to subscribers since the source started. Diagnostic only.
     */
    long totalEventsProcessed();

    /**
     * Events rejected because the source was saturated. Diagnostic only.
     */
    default long overflowCount() {
        return 0L;
    }
}
