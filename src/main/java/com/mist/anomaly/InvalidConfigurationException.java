package com.mist.anomaly;

/**
 * A length, order, threshold or other parameter is out of range.  Raised before any computation starts.
 */
public class InvalidConfigurationException extends AnomalyDetectionException {
    public InvalidConfigurationException(String message) {
        super("InvalidConfiguration: " + message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super("InvalidConfiguration: " + message, cause);
    }
}
