package com.simdash.dashboard.render;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the latest rendered frame.
 */
@RestController
@RequiredArgsConstructor
public class RenderController {

    private final LatestSnapshotHolder snapshotHolder;

    @GetMapping("/dashboard/snapshot")
    public ResponseEntity<RenderSnapshot> snapshot() {
        return snapshotHolder.latest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
