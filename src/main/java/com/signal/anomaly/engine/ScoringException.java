package com.signal.anomaly.engine;

/**
 * Raised when the outlier scorer cannot produce verdicts for a batch
 * (batch too small, non-finite values, malformed scorer output).
 * Scoped to a single window: the detector's buffer is left as it was.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
