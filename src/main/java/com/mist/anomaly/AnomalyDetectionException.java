package com.mist.anomaly;

/**
 * Base class for failures of the simulate / fit / detect pipeline.
 */
public class AnomalyDetectionException extends Exception {
    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
