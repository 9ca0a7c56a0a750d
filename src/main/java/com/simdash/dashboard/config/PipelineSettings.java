package com.simdash.dashboard.config;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable configuration of one dashboard pipeline.
 *
 * Fixed at construction:
 * - monitored keys, in first-seen order, duplicates removed
 * - refresh interval, clamped to [10, 1000] ms
 * - per-key point cap
 * - downsample target point count
 */
@Slf4j
@Getter
@ToString
public final class PipelineSettings {

    public static final long DEFAULT_REFRESH_INTERVAL_MS = 50;
    public static final long MIN_REFRESH_INTERVAL_MS = 10;
    public static final long MAX_REFRESH_INTERVAL_MS = 1000;
    public static final int DEFAULT_MAX_POINTS = 1000;
    public static final int DEFAULT_DOWNSAMPLE_TARGET = 500;

    private static final String COMMENT_PREFIX = "//";

    private final List<String> monitoredKeys;
    @Getter(AccessLevel.NONE)
    private final Set<String> monitoredKeySet;
    private final long refreshIntervalMs;
    private final int maxPoints;
    private final int downsampleTarget;
    private final TimestampPolicy timestampPolicy;

    private PipelineSettings(
            List<String> monitoredKeys,
            long refreshIntervalMs,
            int maxPoints,
            int downsampleTarget,
            TimestampPolicy timestampPolicy
    ) {
        this.monitoredKeys = Collections.unmodifiableList(monitoredKeys);
        this.monitoredKeySet = Collections.unmodifiableSet(new LinkedHashSet<>(monitoredKeys));
        this.refreshIntervalMs = refreshIntervalMs;
        this.maxPoints = maxPoints;
        this.downsampleTarget = downsampleTarget;
        this.timestampPolicy = timestampPolicy;
    }

    public static PipelineSettings of(Collection<String> monitoredKeys) {
        return of(monitoredKeys, DEFAULT_REFRESH_INTERVAL_MS, DEFAULT_MAX_POINTS,
                DEFAULT_DOWNSAMPLE_TARGET, TimestampPolicy.TRUST);
    }

    /**
     * Build validated settings.
     *
     * @throws IllegalArgumentException if no usable key remains, maxPoints is below 1
     *                                  or downsampleTarget is below 2
     */
    public static PipelineSettings of(
            Collection<String> monitoredKeys,
            long refreshIntervalMs,
            int maxPoints,
            int downsampleTarget,
            TimestampPolicy timestampPolicy
    ) {
        List<String> keys = normalizeKeys(monitoredKeys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one monitored key is required");
        }
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be >= 1, was " + maxPoints);
        }
        if (downsampleTarget < 2) {
            throw new IllegalArgumentException("downsampleTarget must be >= 2, was " + downsampleTarget);
        }
        return new PipelineSettings(
                keys,
                clampRefreshInterval(refreshIntervalMs),
                maxPoints,
                downsampleTarget,
                timestampPolicy != null ? timestampPolicy : TimestampPolicy.TRUST
        );
    }

    /**
     * Parse the free-form key list used in configuration files.
     * Entries are separated by commas or line breaks.
     */
    public static List<String> parseKeys(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            String trimmedLine = line.trim();
            if (trimmedLine.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            Collections.addAll(out, trimmedLine.split(","));
        }
        return out;
    }

    public boolean isMonitored(String key) {
        return monitoredKeySet.contains(key);
    }

    static long clampRefreshInterval(long requestedMs) {
        long clamped = Math.max(MIN_REFRESH_INTERVAL_MS, Math.min(MAX_REFRESH_INTERVAL_MS, requestedMs));
        if (clamped != requestedMs) {
            log.warn("Refresh interval {} ms outside [{}, {}], using {} ms",
                    requestedMs, MIN_REFRESH_INTERVAL_MS, MAX_REFRESH_INTERVAL_MS, clamped);
        }
        return clamped;
    }

    private static List<String> normalizeKeys(Collection<String> rawKeys) {
        if (rawKeys == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String raw : rawKeys) {
            if (raw == null) {
                continue;
            }
            String key = raw.trim();
            if (key.isEmpty() || key.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            unique.add(key);
        }
        return new ArrayList<>(unique);
    }
}
