package com.mist.anomaly;

import com.mist.anomaly.common.SeriesUtils;

import java.util.Arrays;

/**
 * Estimated ARIMA coefficients and fit statistics.  Immutable; produced by {@link AutoregressiveModel#fit}.
 */
public final class FittedModel {
    private final ModelOrder order;
    private final double[] arCoefficients;
    private final double[] maCoefficients;
    private final double constant;
    private final double innovationVariance;
    private final int observations;
    private final double logLikelihood;
    private final int iterations;

    public FittedModel(ModelOrder order, double[] arCoefficients, double[] maCoefficients, double constant,
                       double innovationVariance, int observations, double logLikelihood, int iterations) {
        assert arCoefficients.length == order.getP() : "FittedModel: expected " + order.getP() + " AR coefficients";
        assert maCoefficients.length == order.getQ() : "FittedModel: expected " + order.getQ() + " MA coefficients";
        this.order = order;
        this.arCoefficients = arCoefficients.clone();
        this.maCoefficients = maCoefficients.clone();
        this.constant = constant;
        this.innovationVariance = innovationVariance;
        this.observations = observations;
        this.logLikelihood = logLikelihood;
        this.iterations = iterations;
    }

    /**
     * In-sample one-step-ahead predictions for every point after the burn-in window.  The prediction for
     * timestamp t reads only values before t.
     * @throws InsufficientDataException if the series is not longer than p + d
     */
    public Prediction predict(Series series) throws InsufficientDataException {
        int burnIn = order.burnIn();
        if (series.size() <= burnIn)
            throw new InsufficientDataException("series of length " + series.size()
                    + " leaves no point to predict for order " + order);

        int d = order.getD();
        double[] levels = series.toArray();
        double[] w = SeriesUtils.difference(levels, d);
        double[] fitted = filter(w, arCoefficients, maCoefficients, constant, new double[w.length]);

        double[] actual = new double[levels.length - burnIn];
        double[] predicted = new double[levels.length - burnIn];
        for (int j = order.getP(); j < w.length; j++) {
            int t = j + d;
            actual[t - burnIn] = levels[t];
            predicted[t - burnIn] = SeriesUtils.undifference(fitted[j], levels, t, d);
        }
        return new Prediction(burnIn, actual, predicted);
    }

    /**
     * Run the ARMA recursion over a differenced series.
     * @param innovations filled with one-step errors; zero inside the first p positions
     * @return one-step predictions of w, NaN inside the first p positions
     */
    static double[] filter(double[] w, double[] ar, double[] ma, double constant, double[] innovations) {
        int p = ar.length;
        double[] fitted = new double[w.length];
        for (int j = 0; j < w.length; j++) {
            if (j < p) {
                fitted[j] = Double.NaN;
                innovations[j] = 0.0;
                continue;
            }
            double value = constant;
            for (int k = 1; k <= p; k++)
                value += ar[k - 1] * w[j - k];
            for (int k = 1; k <= ma.length && j - k >= 0; k++)
                value += ma[k - 1] * innovations[j - k];
            fitted[j] = value;
            innovations[j] = w[j] - value;
        }
        return fitted;
    }

    public ModelOrder getOrder() {
        return order;
    }

    public double[] getArCoefficients() {
        return arCoefficients.clone();
    }

    public double[] getMaCoefficients() {
        return maCoefficients.clone();
    }

    public double getConstant() {
        return constant;
    }

    public double getInnovationVariance() {
        return innovationVariance;
    }

    public int getObservations() {
        return observations;
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    /**
     * Estimated parameters: the regression coefficients plus the innovation variance.
     */
    public int getParameterCount() {
        return order.coefficientCount() + 1;
    }

    public double getAic() {
        return -2.0 * logLikelihood + 2.0 * getParameterCount();
    }

    public double getBic() {
        return -2.0 * logLikelihood + getParameterCount() * Math.log(observations);
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "FittedModel [order=" + order + ", ar=" + Arrays.toString(arCoefficients) + ", ma="
                + Arrays.toString(maCoefficients) + ", constant=" + constant + ", sigma2=" + innovationVariance
                + ", aic=" + getAic() + "]";
    }
}
