package com.mist.anomaly;

/**
 * The series is too short for the burn-in window of the requested model order.
 */
public class InsufficientDataException extends AnomalyDetectionException {
    public InsufficientDataException(String message) {
        super("InsufficientData: " + message);
    }
}
