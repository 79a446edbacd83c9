package com.mist.anomaly;

import com.mist.anomaly.Simulation.InjectionKind;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.log4j.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Generates synthetic hourly CPU utilization: baseline + trend + daily sine + Gaussian noise, with spikes and
 * crashes injected at random, non-adjacent hours.
 */
public class SeriesSimulator {
    private static final Logger logger = Logger.getLogger(SeriesSimulator.class);

    private final SimulatorConfig config;

    public SeriesSimulator() {
        this(SimulatorConfig.defaults());
    }

    /**
     * @param config copied, later changes to it do not affect this simulator
     */
    public SeriesSimulator(SimulatorConfig config) {
        assert config != null : "SeriesSimulator: config cannot be null";
        this.config = config.copy();
    }

    public SimulatorConfig getConfig() {
        return config.copy();
    }

    /**
     * Generate a series.  Two calls with the same length and seed return identical series and injections.
     * @param length number of hourly points
     * @param seed seed of the generator drawing noise and anomaly placement
     */
    public Simulation generate(int length, long seed) throws InvalidConfigurationException {
        return generate(length, new Well19937c(seed));
    }

    /**
     * Generate a series drawing all randomness from the given generator.
     */
    public Simulation generate(int length, RandomGenerator random) throws InvalidConfigurationException {
        if (length <= 0)
            throw new InvalidConfigurationException("series length must be greater than zero, got " + length);
        config.validate();
        if (config.getAnomalyCount() * 3 > length)
            throw new InvalidConfigurationException("cannot place " + config.getAnomalyCount()
                    + " non-adjacent anomalies in " + length + " points");

        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            double baseline = config.getBaseLevel() + config.getTrendSlope() * i;
            double seasonal = config.getAmplitude()
                    * Math.sin(2 * Math.PI * (i % config.getPeriod()) / config.getPeriod());
            double noise = random.nextGaussian() * config.getNoiseSigma();
            values[i] = clip(baseline + seasonal + noise);
        }

        Map<Integer, InjectionKind> injected = new HashMap<Integer, InjectionKind>();
        int count = config.getAnomalyCount();
        if (count > 0) {
            int segment = length / count;
            for (int s = 0; s < count; s++) {
                // keep off the segment edges so neighbouring events never touch
                int start = s * segment;
                int end = (s == count - 1) ? length - 1 : start + segment - 1;
                int idx = start + 1 + random.nextInt(end - start - 1);

                if (random.nextDouble() < config.getDropProbability()) {
                    values[idx] = clip(values[idx] * (1.0 - config.getDropFraction()));
                    injected.put(idx, InjectionKind.DROP);
                } else {
                    values[idx] = clip(values[idx] * (1.0 + config.getSpikeFraction()));
                    injected.put(idx, InjectionKind.SPIKE);
                }
            }
        }

        logger.debug("Simulated " + length + " points, injected " + injected);
        return new Simulation(new Series(values), injected);
    }

    private double clip(double value) {
        if (!config.isClip())
            return value;
        return Math.max(config.getFloorValue(), Math.min(config.getCeilingValue(), value));
    }
}
