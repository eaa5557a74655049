package com.signal.anomaly.engine;

/**
 * Invalid detector or scorer parameters. Thrown at construction time, never mid-stream.
 */
public class DetectionConfigurationException extends IllegalArgumentException {

    private final String field;

    public DetectionConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
