package com.mist.anomaly.report;

import com.mist.anomaly.AnomalyRecord;
import com.mist.anomaly.FittedModel;
import com.mist.anomaly.GroundTruthEvaluation;
import org.apache.commons.math3.stat.StatUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Diagnostic JSON summary of one run.  Never read back: models are refitted on every run.
 */
public class ModelSummary {

    @SuppressWarnings("unchecked")
    public static JSONObject build(FittedModel model, List<AnomalyRecord> records, double sigmaThreshold,
                                   GroundTruthEvaluation evaluation) {
        JSONObject order = new JSONObject();
        order.put("p", model.getOrder().getP());
        order.put("d", model.getOrder().getD());
        order.put("q", model.getOrder().getQ());
        order.put("constant", model.getOrder().hasConstant());

        JSONObject fit = new JSONObject();
        fit.put("ar", toJsonArray(model.getArCoefficients()));
        fit.put("ma", toJsonArray(model.getMaCoefficients()));
        fit.put("constant", model.getConstant());
        fit.put("sigma2", model.getInnovationVariance());
        fit.put("observations", model.getObservations());
        fit.put("log_likelihood", model.getLogLikelihood());
        fit.put("aic", model.getAic());
        fit.put("bic", model.getBic());
        fit.put("iterations", model.getIterations());

        double[] residuals = new double[records.size()];
        JSONArray anomalies = new JSONArray();
        for (int i = 0; i < records.size(); i++) {
            residuals[i] = records.get(i).getResidual();
            if (records.get(i).isAnomaly())
                anomalies.add(records.get(i).getTimestamp());
        }

        JSONObject detection = new JSONObject();
        detection.put("sigma_threshold", sigmaThreshold);
        detection.put("records", records.size());
        detection.put("residual_std", residuals.length > 1 ? Math.sqrt(StatUtils.variance(residuals)) : 0.0);
        detection.put("anomaly_count", anomalies.size());
        detection.put("anomalies", anomalies);

        JSONObject summary = new JSONObject();
        summary.put("order", order);
        summary.put("fit", fit);
        summary.put("detection", detection);
        if (evaluation != null) {
            JSONObject validation = new JSONObject();
            validation.put("hits", toJsonArray(evaluation.getHits()));
            validation.put("missed", toJsonArray(evaluation.getMissed()));
            validation.put("false_alarms", evaluation.getFalseAlarms().size());
            validation.put("recall", evaluation.getRecall());
            validation.put("precision", evaluation.getPrecision());
            summary.put("validation", validation);
        }
        return summary;
    }

    public static void save(JSONObject summary, Path path) throws IOException {
        if (path.getParent() != null)
            Files.createDirectories(path.getParent());
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            summary.writeJSONString(writer);
        }
    }

    @SuppressWarnings("unchecked")
    private static JSONArray toJsonArray(double[] values) {
        JSONArray array = new JSONArray();
        for (double v : values)
            array.add(v);
        return array;
    }

    @SuppressWarnings("unchecked")
    private static JSONArray toJsonArray(List<Integer> values) {
        JSONArray array = new JSONArray();
        array.addAll(values);
        return array;
    }
}
