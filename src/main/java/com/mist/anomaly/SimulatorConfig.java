package com.mist.anomaly;

/**
 * Parameters of the synthetic CPU series.  Defaults reproduce 30 days of hourly load around 40% with a slow upward
 * trend, a daily cycle and five injected events.
 */
public class SimulatorConfig {
    private double baseLevel = 40.0;
    private double trendSlope = 0.05;
    private double amplitude = 10.0;
    private int period = 24;
    private double noiseSigma = 2.0;
    private int anomalyCount = 5;
    private double spikeFraction = 0.30;
    private double dropFraction = 0.60;
    private double dropProbability = 0.5;
    private boolean clip = true;
    private double floorValue = 0.0;
    private double ceilingValue = 100.0;

    public static SimulatorConfig defaults() {
        return new SimulatorConfig();
    }

    public SimulatorConfig copy() {
        return defaults()
                .withBaseLevel(baseLevel)
                .withTrendSlope(trendSlope)
                .withAmplitude(amplitude)
                .withPeriod(period)
                .withNoiseSigma(noiseSigma)
                .withAnomalyCount(anomalyCount)
                .withSpikeFraction(spikeFraction)
                .withDropFraction(dropFraction)
                .withDropProbability(dropProbability)
                .withClip(clip, floorValue, ceilingValue);
    }

    /**
     * @throws InvalidConfigurationException if a parameter cannot produce a series
     */
    public void validate() throws InvalidConfigurationException {
        if (period <= 0)
            throw new InvalidConfigurationException("period must be greater than zero, got " + period);
        if (noiseSigma < 0 || Double.isNaN(noiseSigma))
            throw new InvalidConfigurationException("noise sigma cannot be negative, got " + noiseSigma);
        if (anomalyCount < 0)
            throw new InvalidConfigurationException("anomaly count cannot be negative, got " + anomalyCount);
        if (spikeFraction < 0 || Double.isNaN(spikeFraction))
            throw new InvalidConfigurationException("spike fraction cannot be negative, got " + spikeFraction);
        if (!(dropFraction >= 0 && dropFraction <= 1))
            throw new InvalidConfigurationException("drop fraction must be within [0, 1], got " + dropFraction);
        if (!(dropProbability >= 0 && dropProbability <= 1))
            throw new InvalidConfigurationException("drop probability must be within [0, 1], got " + dropProbability);
        if (clip && floorValue > ceilingValue)
            throw new InvalidConfigurationException("floor " + floorValue + " is above ceiling " + ceilingValue);
    }

    public double getBaseLevel() {
        return baseLevel;
    }

    public SimulatorConfig withBaseLevel(double baseLevel) {
        this.baseLevel = baseLevel;
        return this;
    }

    public double getTrendSlope() {
        return trendSlope;
    }

    public SimulatorConfig withTrendSlope(double trendSlope) {
        this.trendSlope = trendSlope;
        return this;
    }

    public double getAmplitude() {
        return amplitude;
    }

    public SimulatorConfig withAmplitude(double amplitude) {
        this.amplitude = amplitude;
        return this;
    }

    public int getPeriod() {
        return period;
    }

    public SimulatorConfig withPeriod(int period) {
        this.period = period;
        return this;
    }

    public double getNoiseSigma() {
        return noiseSigma;
    }

    public SimulatorConfig withNoiseSigma(double noiseSigma) {
        this.noiseSigma = noiseSigma;
        return this;
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    public SimulatorConfig withAnomalyCount(int anomalyCount) {
        this.anomalyCount = anomalyCount;
        return this;
    }

    public double getSpikeFraction() {
        return spikeFraction;
    }

    public SimulatorConfig withSpikeFraction(double spikeFraction) {
        this.spikeFraction = spikeFraction;
        return this;
    }

    public double getDropFraction() {
        return dropFraction;
    }

    public SimulatorConfig withDropFraction(double dropFraction) {
        this.dropFraction = dropFraction;
        return this;
    }

    public double getDropProbability() {
        return dropProbability;
    }

    public SimulatorConfig withDropProbability(double dropProbability) {
        this.dropProbability = dropProbability;
        return this;
    }

    public boolean isClip() {
        return clip;
    }

    public double getFloorValue() {
        return floorValue;
    }

    public double getCeilingValue() {
        return ceilingValue;
    }

    public SimulatorConfig withClip(boolean clip, double floorValue, double ceilingValue) {
        this.clip = clip;
        this.floorValue = floorValue;
        this.ceilingValue = ceilingValue;
        return this;
    }

    @Override
    public String toString() {
        return "SimulatorConfig [baseLevel=" + baseLevel + ", trendSlope=" + trendSlope + ", amplitude=" + amplitude
                + ", period=" + period + ", noiseSigma=" + noiseSigma + ", anomalyCount=" + anomalyCount
                + ", spikeFraction=" + spikeFraction + ", dropFraction=" + dropFraction
                + ", dropProbability=" + dropProbability + ", clip=" + clip + "]";
    }
}
