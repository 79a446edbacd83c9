package com.mist.anomaly.report;

import com.mist.anomaly.AnomalyRecord;
import com.mist.anomaly.FittedModel;
import com.mist.anomaly.GroundTruthEvaluation;
import com.mist.anomaly.ModelOrder;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ModelSummaryTest {

    @Test
    void summarisesFitDetectionAndValidation(@TempDir Path dir) throws Exception {
        FittedModel model = new FittedModel(ModelOrder.of(2, 1, 0), new double[]{0.4, -0.1}, new double[0], 0.0,
                2.0, 100, -150.0, 1);
        List<AnomalyRecord> records = Arrays.asList(
                new AnomalyRecord(3, 70.0, 42.0, 28.0, 3.5, true),
                new AnomalyRecord(4, 43.0, 44.0, -1.0, -0.5, false));
        GroundTruthEvaluation evaluation = GroundTruthEvaluation.evaluate(records, Collections.singletonList(3));

        Path file = dir.resolve("model_summary.json");
        ModelSummary.save(ModelSummary.build(model, records, 2.5, evaluation), file);

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JSONObject summary = (JSONObject) new JSONParser().parse(reader);
            JSONObject order = (JSONObject) summary.get("order");
            assertEquals(2L, order.get("p"));
            assertEquals(false, order.get("constant"));

            JSONObject fit = (JSONObject) summary.get("fit");
            assertEquals(Arrays.asList(0.4, -0.1), fit.get("ar"));
            assertEquals(306.0, (Double) fit.get("aic"), 1e-9);

            JSONObject detection = (JSONObject) summary.get("detection");
            assertEquals(1L, detection.get("anomaly_count"));
            assertEquals(Collections.singletonList(3L), detection.get("anomalies"));

            JSONObject validation = (JSONObject) summary.get("validation");
            assertEquals(1.0, (Double) validation.get("recall"), 0.0);
            assertEquals(0L, validation.get("false_alarms"));
        }
    }

    @Test
    void validationIsOmittedForLoadedData() throws Exception {
        FittedModel model = new FittedModel(ModelOrder.of(1, 0, 0), new double[]{0.4}, new double[0], 1.0,
                2.0, 100, -150.0, 1);
        JSONObject summary = ModelSummary.build(model, Collections.<AnomalyRecord>emptyList(), 2.5, null);
        assertFalse(summary.containsKey("validation"));
        assertEquals(0, ((JSONArray) ((JSONObject) summary.get("detection")).get("anomalies")).size());
    }
}
