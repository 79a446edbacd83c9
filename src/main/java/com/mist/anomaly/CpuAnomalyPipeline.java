package com.mist.anomaly;

import com.mist.anomaly.common.SeriesUtils;
import com.mist.anomaly.data.SeriesData;
import com.mist.anomaly.report.AnomalyReporter;
import com.mist.anomaly.report.DetectionChart;
import com.mist.anomaly.report.ModelSummary;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Simulates (or loads) hourly CPU data, fits an ARIMA model, flags residual outliers and writes the chart, the
 * report and a run summary.  Any failing stage aborts the remaining ones.
 */
public class CpuAnomalyPipeline {
    private static final Logger logger = Logger.getLogger(CpuAnomalyPipeline.class);

    private final PipelineConfig config;

    public CpuAnomalyPipeline(PipelineConfig config) {
        this.config = config;
    }

    public static class Result {
        private final Series series;
        private final List<Integer> injectedIndices;
        private final FittedModel model;
        private final List<AnomalyRecord> records;
        private final GroundTruthEvaluation evaluation;

        Result(Series series, List<Integer> injectedIndices, FittedModel model, List<AnomalyRecord> records,
               GroundTruthEvaluation evaluation) {
            this.series = series;
            this.injectedIndices = injectedIndices;
            this.model = model;
            this.records = records;
            this.evaluation = evaluation;
        }

        public Series getSeries() {
            return series;
        }

        /**
         * @return injected indices when the series was simulated, empty for loaded data
         */
        public List<Integer> getInjectedIndices() {
            return injectedIndices;
        }

        public FittedModel getModel() {
            return model;
        }

        public List<AnomalyRecord> getRecords() {
            return records;
        }

        /**
         * @return null when the series was loaded and has no ground truth
         */
        public GroundTruthEvaluation getEvaluation() {
            return evaluation;
        }

        public int getAnomalyCount() {
            return AnomalyDetector.anomaliesOnly(records).size();
        }
    }

    public Result run() throws AnomalyDetectionException, IOException {
        logger.info("--- STARTING CPU ANOMALY DETECTION PIPELINE ---");

        // 1. data
        Series series;
        List<Integer> injected = new ArrayList<Integer>();
        Path input = config.getInputPath();
        if (input != null) {
            logger.info("[1/5] Loading CPU dataset from " + input + " ...");
            series = SeriesData.load(input);
        } else {
            logger.info("[1/5] Generating synthetic CPU dataset...");
            SeriesSimulator simulator = new SeriesSimulator(config.getSimulatorConfig());
            Simulation simulation = simulator.generate(config.getLength(), config.getSeed());
            series = simulation.getSeries();
            injected = simulation.getInjectedIndices();
            Path dataPath = config.getDataPath();
            SeriesData.save(series, dataPath);
            logger.info("      Data saved to " + dataPath);
        }

        // 2. fit
        ModelOrder order = config.getModelOrder();
        logger.info("[2/5] Training ARIMA" + order + " model on " + series.size() + " points...");
        FittedModel model = config.getAutoregressiveModel().fit(series, order);
        logger.info(String.format("      Model AIC: %.2f, BIC: %.2f", model.getAic(), model.getBic()));

        // 3. detect
        logger.info("[3/5] Calculating residuals and detecting anomalies...");
        double threshold = config.getSigmaThreshold();
        AnomalyDetector detector = new AnomalyDetector(config.getDirection());
        List<AnomalyRecord> records = detector.detect(series, model, threshold);
        List<AnomalyRecord> anomalies = AnomalyDetector.anomaliesOnly(records);
        logger.info("      Detected " + anomalies.size() + " anomalies (Threshold: " + threshold + " sigma)");
        logger.info(String.format("      In-sample RMSE: %.3f", rmse(records)));

        GroundTruthEvaluation evaluation = null;
        if (input == null) {
            evaluation = GroundTruthEvaluation.evaluate(records, injected);
            logger.info("      Injected " + injected + ", recall " + evaluation.getRecall()
                    + ", precision " + String.format("%.2f", evaluation.getPrecision()));
        }

        // 4. chart
        if (config.isChartEnabled()) {
            logger.info("[4/5] Generating visualization...");
            Path plotPath = config.getOutputPath("plot.file");
            DetectionChart.save(DetectionChart.build(series, records, threshold), plotPath);
            logger.info("      Plot saved to " + plotPath);
        } else {
            logger.info("[4/5] Visualization disabled");
        }

        // 5. report
        logger.info("[5/5] Saving anomaly report...");
        Path reportPath = config.getOutputPath("report.file");
        int rows = new AnomalyReporter(config.isAnomaliesOnly()).write(series, records, reportPath);
        logger.info("      Report saved to " + reportPath + " (" + rows + " rows)");
        Path summaryPath = config.getOutputPath("summary.file");
        ModelSummary.save(ModelSummary.build(model, records, threshold, evaluation), summaryPath);

        logger.info("--- PIPELINE COMPLETE ---");
        logger.info("Check the '" + config.getRequired("output.dir") + "' folder for results.");
        return new Result(series, injected, model, records, evaluation);
    }

    private static double rmse(List<AnomalyRecord> records) {
        List<Double> actual = new ArrayList<Double>();
        List<Double> predicted = new ArrayList<Double>();
        for (AnomalyRecord record : records) {
            actual.add(record.getActual());
            predicted.add(record.getPredicted());
        }
        return SeriesUtils.getRMSE(actual, predicted);
    }

    public static Options buildOptions() {
        Options options = new Options();
        options.addOption(new Option("c", "config", true, "Properties file overriding the bundled defaults"));
        options.addOption(new Option("i", "input", true, "timestamp,cpu_percent CSV to analyse instead of simulating"));
        options.addOption(new Option("s", "seed", true, "Seed of the simulation"));
        options.addOption(new Option("n", "length", true, "Number of hourly points to simulate"));
        options.addOption(new Option("p", "order", true, "ARIMA order as p,d,q"));
        options.addOption(new Option("t", "threshold", true, "Anomaly threshold in residual standard deviations"));
        options.addOption(new Option(null, "direction", true, "UP, DOWN or UPDOWN"));
        options.addOption(new Option("o", "output-dir", true, "Directory for the chart, report and summary"));
        options.addOption(new Option(null, "anomalies-only", false, "Write only flagged rows to the report"));
        options.addOption(new Option(null, "no-chart", false, "Skip the chart"));
        options.addOption(new Option("h", "help", false, "Print this help"));
        return options;
    }

    public static CommandLine parseArgs(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        return parser.parse(buildOptions(), args);
    }

    public static PipelineConfig loadConfig(CommandLine cmdLine) throws IOException {
        PipelineConfig config = PipelineConfig.defaults();
        if (cmdLine.hasOption("config"))
            config.overlay(Paths.get(cmdLine.getOptionValue("config")));
        return config.overlay(cmdLine);
    }

    public static void main(String[] args) {
        CommandLine cmdLine;
        try {
            cmdLine = parseArgs(args);
        } catch (ParseException exp) {
            System.err.println(exp.getMessage());
            new HelpFormatter().printHelp("cpu-anomaly-detection", buildOptions());
            System.exit(2);
            return;
        }
        if (cmdLine.hasOption("help")) {
            new HelpFormatter().printHelp("cpu-anomaly-detection", buildOptions());
            return;
        }

        try {
            new CpuAnomalyPipeline(loadConfig(cmdLine)).run();
        } catch (AnomalyDetectionException e) {
            logger.error("Pipeline aborted: " + e.getMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            logger.error("Pipeline aborted on I/O failure: " + e.getMessage(), e);
            System.exit(1);
        }
    }
}
