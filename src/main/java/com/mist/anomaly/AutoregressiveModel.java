package com.mist.anomaly;

import com.mist.anomaly.common.SeriesUtils;
import org.apache.log4j.Logger;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.PhysicalStore;
import org.ojalgo.matrix.store.PrimitiveDenseStore;

/**
 * Fits ARIMA(p, d, q) by conditional least squares.  The series is differenced d times, then the coefficients of
 *
 *   w(t) = c + phi_1 w(t-1) + ... + phi_p w(t-p) + theta_1 e(t-1) + ... + theta_q e(t-q) + e(t)
 *
 * are estimated with recursive least squares.  For q > 0 the innovations e are not observed: they start from the
 * residuals of a long autoregression and are re-estimated until the coefficients settle.
 */
public class AutoregressiveModel {
    private static final Logger logger = Logger.getLogger(AutoregressiveModel.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6;
    // initial diagonal of the RLS inverse Gram matrix; large means a negligible ridge penalty
    private static final double INITIAL_COVARIANCE = 1e6;
    private static final int LONG_AR_EXTRA_LAGS = 8;

    private final int maxIterations;
    private final double tolerance;

    public AutoregressiveModel() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    /**
     * @param maxIterations bound on estimation passes when q > 0
     * @param tolerance largest coefficient change between passes that counts as converged
     */
    public AutoregressiveModel(int maxIterations, double tolerance) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public FittedModel fit(Series series, ModelOrder order) throws AnomalyDetectionException {
        if (maxIterations <= 0)
            throw new InvalidConfigurationException("max iterations must be greater than zero, got " + maxIterations);
        if (!(tolerance > 0))
            throw new InvalidConfigurationException("tolerance must be greater than zero, got " + tolerance);
        if (series.size() <= order.burnIn())
            throw new InsufficientDataException("series of length " + series.size() + " is too short for order "
                    + order + ", need more than " + order.burnIn() + " points");

        int p = order.getP();
        int q = order.getQ();
        double[] w = SeriesUtils.difference(series.toArray(), order.getD());
        int observations = w.length - p;

        double[] innovations = q > 0 ? initialInnovations(w, order) : new double[w.length];
        double[] theta = new double[0];
        double[] previous = null;
        int iterations = 0;
        boolean converged = order.coefficientCount() == 0;
        while (!converged && iterations < maxIterations) {
            iterations++;
            theta = regress(w, innovations, p, q, order.hasConstant(), p);
            if (!SeriesUtils.allFinite(theta))
                throw new NonConvergenceException("estimates diverged on pass " + iterations + " for order " + order, iterations);

            if (q == 0 || (previous != null && SeriesUtils.maxAbsDiff(theta, previous) < tolerance)) {
                converged = true;
            } else {
                previous = theta;
                innovations = new double[w.length];
                FittedModel.filter(w, arPart(theta, p), maPart(theta, p, q), constantPart(theta, order), innovations);
            }
        }
        if (!converged)
            throw new NonConvergenceException("coefficients still moving after " + iterations + " passes for order "
                    + order + " (tolerance " + tolerance + ")", iterations);

        double[] ar = arPart(theta, p);
        double[] ma = maPart(theta, p, q);
        double constant = constantPart(theta, order);
        double[] residuals = new double[w.length];
        FittedModel.filter(w, ar, ma, constant, residuals);

        double sse = 0.0;
        for (int j = p; j < w.length; j++)
            sse += residuals[j] * residuals[j];
        double variance = sse / observations;
        double logLikelihood = -0.5 * observations * (Math.log(2 * Math.PI * variance) + 1.0);
        if (Double.isNaN(logLikelihood))
            throw new NonConvergenceException("residual variance is not a number for order " + order, iterations);

        FittedModel model = new FittedModel(order, ar, ma, constant, variance, observations, logLikelihood, iterations);
        logger.debug("Fitted " + model + " in " + iterations + " passes");
        return model;
    }

    /**
     * Hannan-Rissanen first stage: residuals of a long AR fit stand in for the unobserved innovations.  Falls back
     * to zeros when the series is too short to support the long fit.
     */
    private double[] initialInnovations(double[] w, ModelOrder order) {
        int m = order.getP() + order.getQ() + LONG_AR_EXTRA_LAGS;
        double[] innovations = new double[w.length];
        if (w.length - m < 2 * (m + 1)) {
            logger.debug("Series too short for a long AR(" + m + "), starting innovations at zero");
            return innovations;
        }
        double[] longAr = regress(w, innovations, m, 0, order.hasConstant(), m);
        double constant = order.hasConstant() ? longAr[m] : 0.0;
        double[] ar = new double[m];
        System.arraycopy(longAr, 0, ar, 0, m);
        FittedModel.filter(w, ar, new double[0], constant, innovations);
        return innovations;
    }

    /**
     * Recursive least squares over rows start..end of the differenced series.  Coefficients are laid out as
     * [ar_1..ar_p, ma_1..ma_q, constant].
     */
    static double[] regress(double[] w, double[] innovations, int p, int q, boolean constant, int start) {
        int k = p + q + (constant ? 1 : 0);
        PhysicalStore.Factory<Double, PrimitiveDenseStore> storeFactory = PrimitiveDenseStore.FACTORY;
        PrimitiveDenseStore weights = storeFactory.makeZero(k, 1);
        PrimitiveDenseStore covariance = storeFactory.copy(storeFactory.makeEye(k, k).multiply(INITIAL_COVARIANCE));
        PrimitiveDenseStore x = storeFactory.makeZero(1, k);

        for (int j = start; j < w.length; j++) {
            // x = [w(j-1)..w(j-p), e(j-1)..e(j-q), 1]
            for (int i = 1; i <= p; i++)
                x.set(0, i - 1, w[j - i]);
            for (int i = 1; i <= q; i++)
                x.set(0, p + i - 1, j - i >= 0 ? innovations[j - i] : 0.0);
            if (constant)
                x.set(0, k - 1, 1.0);

            // gain = P x' / (1 + x P x')
            MatrixStore<Double> px = covariance.multiply(x.transpose());
            double denominator = 1.0 + x.multiply(px).doubleValue(0, 0);
            MatrixStore<Double> gain = px.multiply(1.0 / denominator);

            // weights = weights + gain * (w(j) - x weights)
            double error = w[j] - x.multiply(weights).doubleValue(0, 0);
            weights = storeFactory.copy(weights.add(gain.multiply(error)));

            // P = P - gain * (P x')'
            covariance = storeFactory.copy(covariance.subtract(gain.multiply(px.transpose())));
        }

        double[] result = new double[k];
        for (int i = 0; i < k; i++)
            result[i] = weights.doubleValue(i, 0);
        return result;
    }

    private static double[] arPart(double[] theta, int p) {
        double[] ar = new double[p];
        System.arraycopy(theta, 0, ar, 0, p);
        return ar;
    }

    private static double[] maPart(double[] theta, int p, int q) {
        double[] ma = new double[q];
        System.arraycopy(theta, p, ma, 0, q);
        return ma;
    }

    private static double constantPart(double[] theta, ModelOrder order) {
        return order.hasConstant() ? theta[order.getP() + order.getQ()] : 0.0;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }
}
