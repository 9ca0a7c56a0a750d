package com.simdash.dashboard.source;

/**
 * Handle returned by {@link EventSource#subscribe(EventConsumer)}.
 *
 * Closing releases the registration; closing again is a no-op.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
