package com.mist.anomaly;

/**
 * Detection outcome for one predicted point.
 */
public final class AnomalyRecord {
    private final long timestamp;
    private final double actual;
    private final double predicted;
    private final double residual;
    private final double zScore;
    private final boolean anomaly;

    public AnomalyRecord(long timestamp, double actual, double predicted, double residual, double zScore, boolean anomaly) {
        this.timestamp = timestamp;
        this.actual = actual;
        this.predicted = predicted;
        this.residual = residual;
        this.zScore = zScore;
        this.anomaly = anomaly;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getActual() {
        return actual;
    }

    public double getPredicted() {
        return predicted;
    }

    public double getResidual() {
        return residual;
    }

    public double getZScore() {
        return zScore;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnomalyRecord)) return false;
        AnomalyRecord other = (AnomalyRecord) o;
        return timestamp == other.timestamp
                && Double.compare(actual, other.actual) == 0
                && Double.compare(predicted, other.predicted) == 0
                && Double.compare(residual, other.residual) == 0
                && Double.compare(zScore, other.zScore) == 0
                && anomaly == other.anomaly;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(timestamp);
        result = 31 * result + Double.hashCode(actual);
        result = 31 * result + Double.hashCode(predicted);
        result = 31 * result + Double.hashCode(residual);
        result = 31 * result + Double.hashCode(zScore);
        return 31 * result + (anomaly ? 1 : 0);
    }

    @Override
    public String toString() {
        return "AnomalyRecord [timestamp=" + timestamp + ", actual=" + actual + ", predicted=" + predicted
                + ", residual=" + residual + ", zScore=" + zScore + ", anomaly=" + anomaly + "]";
    }
}
