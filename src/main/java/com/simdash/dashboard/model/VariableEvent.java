package com.simdash.dashboard.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single variable-change event emitted by the simulation engine.
 *
 * Timestamp and value are boxed: a producer may hand over an entry with a
 * missing field, which the pipeline treats as malformed and skips.
 */
@Value
@Builder
public class VariableEvent {

    String key;

    // simulation-time units
    Double timestamp;

    Double value;

    String eventType;
}
