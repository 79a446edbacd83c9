package com.mist.anomaly;

import com.mist.anomaly.AnomalyDetector.AnomalyDirection;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Pipeline settings.  Layers, lowest first: anomaly-detection.properties on the classpath, an optional properties
 * file, command line options.
 */
public class PipelineConfig {
    private static final Logger logger = Logger.getLogger(PipelineConfig.class);

    public static final String DEFAULTS_RESOURCE = "anomaly-detection.properties";

    private final Properties properties;

    PipelineConfig(Properties properties) {
        this.properties = properties;
    }

    public static PipelineConfig defaults() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                throw new IOException("missing classpath resource " + DEFAULTS_RESOURCE);
            properties.load(in);
        }
        return new PipelineConfig(properties);
    }

    /**
     * Overlay the keys of a properties file on the current settings.
     */
    public PipelineConfig overlay(Path file) throws IOException {
        Properties overrides = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            overrides.load(reader);
        }
        properties.putAll(overrides);
        logger.info("Loaded " + overrides.size() + " settings from " + file);
        return this;
    }

    /**
     * Overlay command line options, see {@link CpuAnomalyPipeline#buildOptions()}.
     */
    public PipelineConfig overlay(CommandLine cmdLine) {
        copyOption(cmdLine, "input", "input.path");
        copyOption(cmdLine, "seed", "simulation.seed");
        copyOption(cmdLine, "length", "simulation.length");
        copyOption(cmdLine, "order", "model.order");
        copyOption(cmdLine, "threshold", "detection.sigma_threshold");
        copyOption(cmdLine, "direction", "detection.direction");
        copyOption(cmdLine, "output-dir", "output.dir");
        if (cmdLine.hasOption("anomalies-only"))
            properties.setProperty("report.anomalies_only", "true");
        if (cmdLine.hasOption("no-chart"))
            properties.setProperty("chart.enabled", "false");
        return this;
    }

    private void copyOption(CommandLine cmdLine, String option, String key) {
        if (cmdLine.hasOption(option))
            properties.setProperty(key, cmdLine.getOptionValue(option));
    }

    public void set(String key, String value) {
        properties.setProperty(key, value);
    }

    public String get(String key) {
        return StringUtils.trimToNull(properties.getProperty(key));
    }

    public String getRequired(String key) throws InvalidConfigurationException {
        String value = get(key);
        if (value == null)
            throw new InvalidConfigurationException("missing setting " + key);
        return value;
    }

    public int getInt(String key) throws InvalidConfigurationException {
        String value = getRequired(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public long getLong(String key) throws InvalidConfigurationException {
        String value = getRequired(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public double getDouble(String key) throws InvalidConfigurationException {
        String value = getRequired(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " must be a number, got '" + value + "'", e);
        }
    }

    public boolean getBoolean(String key) throws InvalidConfigurationException {
        String value = getRequired(key);
        if (value.equalsIgnoreCase("true"))
            return true;
        if (value.equalsIgnoreCase("false"))
            return false;
        throw new InvalidConfigurationException(key + " must be true or false, got '" + value + "'");
    }

    public Path getInputPath() {
        String value = get("input.path");
        return value == null ? null : Paths.get(value);
    }

    public Path getDataPath() throws InvalidConfigurationException {
        return Paths.get(getRequired("data.path"));
    }

    public Path getOutputPath(String fileKey) throws InvalidConfigurationException {
        return Paths.get(getRequired("output.dir"), getRequired(fileKey));
    }

    public int getLength() throws InvalidConfigurationException {
        return getInt("simulation.length");
    }

    public long getSeed() throws InvalidConfigurationException {
        return getLong("simulation.seed");
    }

    public SimulatorConfig getSimulatorConfig() throws InvalidConfigurationException {
        SimulatorConfig config = SimulatorConfig.defaults()
                .withBaseLevel(getDouble("simulation.base_level"))
                .withTrendSlope(getDouble("simulation.trend_slope"))
                .withAmplitude(getDouble("simulation.amplitude"))
                .withPeriod(getInt("simulation.period"))
                .withNoiseSigma(getDouble("simulation.noise_sigma"))
                .withAnomalyCount(getInt("simulation.anomaly_count"))
                .withSpikeFraction(getDouble("simulation.spike_fraction"))
                .withDropFraction(getDouble("simulation.drop_fraction"))
                .withDropProbability(getDouble("simulation.drop_probability"))
                .withClip(getBoolean("simulation.clip"), getDouble("simulation.floor"), getDouble("simulation.ceiling"));
        config.validate();
        return config;
    }

    public ModelOrder getModelOrder() throws InvalidConfigurationException {
        return ModelOrder.parse(getRequired("model.order"));
    }

    public AutoregressiveModel getAutoregressiveModel() throws InvalidConfigurationException {
        return new AutoregressiveModel(getInt("model.max_iterations"), getDouble("model.tolerance"));
    }

    public double getSigmaThreshold() throws InvalidConfigurationException {
        double threshold = getDouble("detection.sigma_threshold");
        if (!(threshold > 0) || Double.isInfinite(threshold))
            throw new InvalidConfigurationException("detection.sigma_threshold must be a positive number, got " + threshold);
        return threshold;
    }

    public AnomalyDirection getDirection() throws InvalidConfigurationException {
        String value = getRequired("detection.direction");
        try {
            return AnomalyDirection.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("detection.direction must be UP, DOWN or UPDOWN, got '" + value + "'", e);
        }
    }

    public boolean isAnomaliesOnly() throws InvalidConfigurationException {
        return getBoolean("report.anomalies_only");
    }

    public boolean isChartEnabled() throws InvalidConfigurationException {
        return getBoolean("chart.enabled");
    }
}
