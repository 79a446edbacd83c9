package com.mist.anomaly;

/**
 * The estimator did not settle on finite coefficients within the allowed number of passes.
 */
public class NonConvergenceException extends AnomalyDetectionException {
    private final int iterations;

    public NonConvergenceException(String message, int iterations) {
        super("NonConvergence: " + message);
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
