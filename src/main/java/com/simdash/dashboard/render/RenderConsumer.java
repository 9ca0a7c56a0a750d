package com.simdash.dashboard.render;

/**
 * Receives render snapshots on the render tick thread.
 */
public interface RenderConsumer {

    void render(RenderSnapshot snapshot);
}
