package com.simdash.dashboard.config;

/**
 * How the pipeline treats an event whose timestamp is earlier than the last
 * accepted timestamp for the same key.
 */
public enum TimestampPolicy {
    /**
     * Feed every event as delivered; ordering is the producer's contract.
     */
    TRUST,
    /**
     * Skip events that would move a key's clock backwards.
     */
    DROP_REGRESSIONS
}
