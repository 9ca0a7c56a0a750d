package com.simdash.dashboard.render;

import java.util.Optional;

/**
 * State owner polled by the {@link RenderScheduler}.
 */
public interface FrameSource {

    /**
     * Copy current state and consume the dirty flag, atomically.
     *
     * @return empty when nothing changed since the previous capture
     */
    Optional<CapturedFrame> captureIfDirty();

    /**
     * Put back a captured frame that could not be published, so the next tick retries it.
     */
    void restore(CapturedFrame frame);
}
