package com.signal.anomaly.model;

/**
 * One reading produced by a signal source. The timestamp (epoch millis) is metadata
 * only; detection works on the value alone.
 */
public record SignalPoint(long timestamp, double value) {}
