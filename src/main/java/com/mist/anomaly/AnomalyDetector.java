package com.mist.anomaly;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flags points whose one-step-ahead residual lies more than a number of residual standard deviations away from
 * zero.  The standard deviation is a single estimate over all residuals of the series.
 */
public class AnomalyDetector {
    private static final Logger logger = Logger.getLogger(AnomalyDetector.class);

    public static final double DEFAULT_SIGMA_THRESHOLD = 2.5;
    // a residual spread below this fraction of the data magnitude is rounding noise around a constant residual
    static final double DEGENERATE_SIGMA_RATIO = 1e-9;

    public enum AnomalyDirection {UP, DOWN, UPDOWN}

    private final AnomalyDirection direction;

    public AnomalyDetector() {
        this(AnomalyDirection.UPDOWN);
    }

    /**
     * @param direction UP flags only spikes, DOWN only drops, UPDOWN both
     */
    public AnomalyDetector(AnomalyDirection direction) {
        assert direction != null : "AnomalyDetector: direction cannot be null";
        this.direction = direction;
    }

    public List<AnomalyRecord> detect(Series series, FittedModel model) throws AnomalyDetectionException {
        return detect(series, model, DEFAULT_SIGMA_THRESHOLD);
    }

    /**
     * Classify every point after the burn-in window.
     * @param sigmaThreshold multiple of the residual standard deviation that must be exceeded, strictly
     * @return one record per predicted point, in timestamp order
     */
    public List<AnomalyRecord> detect(Series series, FittedModel model, double sigmaThreshold) throws AnomalyDetectionException {
        if (!(sigmaThreshold > 0) || Double.isInfinite(sigmaThreshold))
            throw new InvalidConfigurationException("sigma threshold must be a positive number, got " + sigmaThreshold);

        Prediction prediction = model.predict(series);
        double[] residuals = prediction.getResiduals();

        DescriptiveStatistics stats = new DescriptiveStatistics(residuals);
        double sigma = stats.getStandardDeviation();
        boolean degenerate = !(sigma > DEGENERATE_SIGMA_RATIO * magnitude(prediction));
        if (degenerate)
            logger.warn("Residual standard deviation is " + sigma + " over " + residuals.length
                    + " points, no point will be flagged");

        List<AnomalyRecord> records = new ArrayList<AnomalyRecord>(residuals.length);
        for (int i = 0; i < residuals.length; i++) {
            double z = degenerate ? 0.0 : residuals[i] / sigma;
            records.add(new AnomalyRecord(prediction.timestampAt(i), prediction.getActual(i),
                    prediction.getPredicted(i), residuals[i], z, isAnomaly(z, sigmaThreshold)));
        }
        return Collections.unmodifiableList(records);
    }

    private static double magnitude(Prediction prediction) {
        double max = 0.0;
        for (int i = 0; i < prediction.size(); i++)
            max = Math.max(max, Math.max(Math.abs(prediction.getActual(i)), Math.abs(prediction.getResidual(i))));
        return max;
    }

    /**
     * Equality with the threshold is not an anomaly.
     */
    public boolean isAnomaly(double zScore, double sigmaThreshold) {
        switch (direction) {
            case UP:
                return zScore > sigmaThreshold;
            case DOWN:
                return zScore < -sigmaThreshold;
            default:
                return Math.abs(zScore) > sigmaThreshold;
        }
    }

    public AnomalyDirection getDirection() {
        return direction;
    }

    public static List<AnomalyRecord> anomaliesOnly(List<AnomalyRecord> records) {
        List<AnomalyRecord> anomalies = new ArrayList<AnomalyRecord>();
        for (AnomalyRecord record : records)
            if (record.isAnomaly())
                anomalies.add(record);
        return anomalies;
    }
}
