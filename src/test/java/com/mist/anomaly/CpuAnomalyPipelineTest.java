package com.mist.anomaly;

import com.mist.anomaly.report.AnomalyReporter;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CpuAnomalyPipelineTest {

    private static PipelineConfig config(Path dir) throws Exception {
        PipelineConfig config = PipelineConfig.defaults();
        config.set("data.path", dir.resolve("data/cpu_data.csv").toString());
        config.set("output.dir", dir.resolve("outputs").toString());
        config.set("chart.enabled", "false");
        config.set("simulation.length", "240");
        return config;
    }

    @Test
    void runsAllStagesAndWritesArtifacts(@TempDir Path dir) throws Exception {
        CpuAnomalyPipeline.Result result = new CpuAnomalyPipeline(config(dir)).run();

        assertEquals(240, result.getSeries().size());
        assertEquals(234, result.getRecords().size());
        assertEquals(5, result.getInjectedIndices().size());
        assertNotNull(result.getEvaluation());

        assertTrue(Files.exists(dir.resolve("data/cpu_data.csv")));
        List<String> report = Files.readAllLines(dir.resolve("outputs/anomaly_report.csv"), StandardCharsets.UTF_8);
        assertEquals(AnomalyReporter.HEADER, report.get(0));
        assertEquals(235, report.size());
        assertTrue(report.get(1).startsWith("2024-01-01 06:00:00,"));
        assertFalse(Files.exists(dir.resolve("outputs/detection_plot.png")));

        try (Reader reader = Files.newBufferedReader(dir.resolve("outputs/model_summary.json"), StandardCharsets.UTF_8)) {
            JSONObject summary = (JSONObject) new JSONParser().parse(reader);
            JSONObject detection = (JSONObject) summary.get("detection");
            assertEquals((long) result.getAnomalyCount(), detection.get("anomaly_count"));
            assertEquals(234L, detection.get("records"));
            assertNotNull(summary.get("validation"));
        }
    }

    @Test
    void loadedDataGivesTheSameDetections(@TempDir Path dir) throws Exception {
        CpuAnomalyPipeline.Result simulated = new CpuAnomalyPipeline(config(dir)).run();

        PipelineConfig reload = config(dir);
        reload.set("input.path", dir.resolve("data/cpu_data.csv").toString());
        reload.set("output.dir", dir.resolve("reloaded").toString());
        reload.set("report.anomalies_only", "true");
        CpuAnomalyPipeline.Result loaded = new CpuAnomalyPipeline(reload).run();

        assertEquals(simulated.getSeries(), loaded.getSeries());
        assertEquals(simulated.getRecords(), loaded.getRecords());
        assertTrue(loaded.getInjectedIndices().isEmpty());
        assertNull(loaded.getEvaluation());
        List<String> report = Files.readAllLines(dir.resolve("reloaded/anomaly_report.csv"), StandardCharsets.UTF_8);
        assertEquals(loaded.getAnomalyCount() + 1, report.size());
    }

    @Test
    void failingStageStopsThePipeline(@TempDir Path dir) throws Exception {
        PipelineConfig config = config(dir);
        config.set("simulation.length", "20");
        config.set("simulation.anomaly_count", "2");
        config.set("model.order", "19,1,0");
        assertThrows(InsufficientDataException.class, () -> new CpuAnomalyPipeline(config).run());
        assertFalse(Files.exists(dir.resolve("outputs/anomaly_report.csv")));
    }
}
