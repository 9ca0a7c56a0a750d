package com.simdash.dashboard.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of pipeline metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Counters only ever grow, except retainedPoints and sourceQueueDepth
 */
public record MetricsSnapshot(

        /* -------- Ingestion -------- */
        long batchesReceived,
        long eventsReceived,
        long eventsAccepted,
        long eventsIgnored,
        long eventsMalformed,
        long eventsOutOfOrder,

        /* -------- State sizes -------- */
        long retainedPoints,

        /* -------- Rendering -------- */
        long rendersPublished,
        long rendersSkipped,
        long rendersFailed,

        /* -------- Source -------- */
        int sourceQueueDepth,
        long sourceEventsProcessed,
        long sourceOverflow,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
