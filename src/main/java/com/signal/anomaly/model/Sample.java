package com.signal.anomaly.model;

/**
 * A scalar observation tagged with its position in the original stream.
 * The index is assigned once at ingestion and never reassigned.
 */
public record Sample(long index, double value) {}
