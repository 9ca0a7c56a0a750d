package com.simdash.dashboard.render;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the most recent snapshot for consumers that poll.
 */
@Component
public class LatestSnapshotHolder implements RenderConsumer {

    private final AtomicReference<RenderSnapshot> latest = new AtomicReference<>();

    @Override
    public void render(RenderSnapshot snapshot) {
        latest.set(snapshot);
    }

    public Optional<RenderSnapshot> latest() {
        return Optional.ofNullable(latest.get());
    }
}
