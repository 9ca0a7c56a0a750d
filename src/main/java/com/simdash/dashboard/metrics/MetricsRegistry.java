package com.simdash.dashboard.metrics;

import com.simdash.dashboard.source.EventSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
@RequiredArgsConstructor
public class MetricsRegistry implements Metrics {

    private final EventSource eventSource;

    private final AtomicLong batchesReceived = new AtomicLong();
    private final AtomicLong eventsReceived = new AtomicLong();
    private final AtomicLong eventsAccepted = new AtomicLong();
    private final AtomicLong eventsIgnored = new AtomicLong();
    private final AtomicLong eventsMalformed = new AtomicLong();
    private final AtomicLong eventsOutOfOrder = new AtomicLong();

    private final AtomicLong retainedPoints = new AtomicLong();

    private final AtomicLong rendersPublished = new AtomicLong();
    private final AtomicLong rendersSkipped = new AtomicLong();
    private final AtomicLong rendersFailed = new AtomicLong();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());


    @Override
    public void onBatchReceived(int size) {
        batchesReceived.incrementAndGet();
        eventsReceived.addAndGet(size);
        touch();
    }

    @Override
    public void onEventAccepted() {
        eventsAccepted.incrementAndGet();
    }

    @Override
    public void onEventIgnored() {
        eventsIgnored.incrementAndGet();
    }

    @Override
    public void onEventMalformed() {
        eventsMalformed.incrementAndGet();
    }

    @Override
    public void onEventOutOfOrder() {
        eventsOutOfOrder.incrementAndGet();
    }

    @Override
    public void onRetainedPointsUpdated(long retained) {
        retainedPoints.set(retained);
    }

    @Override
    public void onRenderPublished() {
        rendersPublished.incrementAndGet();
        touch();
    }

    @Override
    public void onRenderSkipped() {
        rendersSkipped.incrementAndGet();
    }

    @Override
    public void onRenderFailed() {
        rendersFailed.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                batchesReceived.get(),
                eventsReceived.get(),
                eventsAccepted.get(),
                eventsIgnored.get(),
                eventsMalformed.get(),
                eventsOutOfOrder.get(),
                retainedPoints.get(),
                rendersPublished.get(),
                rendersSkipped.get(),
                rendersFailed.get(),
                eventSource.queueDepth(),
                eventSource.totalEventsProcessed(),
                eventSource.overflowCount(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
