package com.mist.anomaly;

/**
 * One-step-ahead predictions of a series, aligned to its tail: element i belongs to timestamp startIndex + i.
 */
public final class Prediction {
    private final int startIndex;
    private final double[] actual;
    private final double[] predicted;

    public Prediction(int startIndex, double[] actual, double[] predicted) {
        assert actual.length == predicted.length : "Prediction: actual and predicted must align";
        this.startIndex = startIndex;
        this.actual = actual.clone();
        this.predicted = predicted.clone();
    }

    /**
     * @return timestamp of the first predicted point, i.e. the burn-in length
     */
    public int getStartIndex() {
        return startIndex;
    }

    public int size() {
        return predicted.length;
    }

    public long timestampAt(int i) {
        return startIndex + i;
    }

    public double getActual(int i) {
        return actual[i];
    }

    public double getPredicted(int i) {
        return predicted[i];
    }

    public double getResidual(int i) {
        return actual[i] - predicted[i];
    }

    public double[] getPredicted() {
        return predicted.clone();
    }

    public double[] getResiduals() {
        double[] residuals = new double[predicted.length];
        for (int i = 0; i < predicted.length; i++)
            residuals[i] = actual[i] - predicted[i];
        return residuals;
    }
}
