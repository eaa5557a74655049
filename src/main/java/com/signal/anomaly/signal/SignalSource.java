package com.signal.anomaly.signal;

import com.signal.anomaly.model.SignalPoint;

/**
 * Ordered sequence of readings fed to the detector. May be finite or unbounded;
 * consumers must not assume a known length.
 */
public interface SignalSource extends Iterable<SignalPoint> {

    /**
     * Short label used in logs.
     */
    String describe();
}
