package com.simdash.dashboard.source;

import com.simdash.dashboard.model.VariableEvent;

import java.util.List;

/**
 * Receives ordered batches of variable-change events from an {@link EventSource}.
 */
public interface EventConsumer {

    /**
     * Process one batch. The list is in producer order and must not be retained.
     */
    void processEventBatch(List<VariableEvent> events);
}
