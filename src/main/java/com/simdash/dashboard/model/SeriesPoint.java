package com.simdash.dashboard.model;

/**
 * Stored projection of a {@link VariableEvent} for one key.
 */
public record SeriesPoint(double timestamp, double value) {}
