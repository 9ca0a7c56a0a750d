package com.simdash.dashboard.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves ingestion counters (accepted, ignored, malformed, out-of-order),
 * render outcomes and event bus status at {@code GET /metrics}.
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final Metrics metrics;

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }
}
