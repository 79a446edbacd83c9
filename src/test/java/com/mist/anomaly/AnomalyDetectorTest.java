package com.mist.anomaly;

import com.mist.anomaly.AnomalyDetector.AnomalyDirection;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnomalyDetectorTest {
    private static Series series;
    private static FittedModel model;

    @BeforeAll
    static void fit() throws Exception {
        series = new SeriesSimulator().generate(720, 42).getSeries();
        model = new AutoregressiveModel().fit(series, ModelOrder.of(5, 1, 0));
    }

    /**
     * Constant level 10 with a spike to 30 at hour 30 and a crash to 0 at hour 60, judged by a model that always
     * predicts 10.
     */
    private static List<AnomalyRecord> spikeAndDrop(AnomalyDirection direction) throws Exception {
        double[] values = new double[100];
        Arrays.fill(values, 10.0);
        values[30] = 30.0;
        values[60] = 0.0;
        FittedModel flat = new FittedModel(ModelOrder.of(0, 0, 0, true), new double[0], new double[0], 10.0,
                1.0, 100, 0.0, 1);
        return new AnomalyDetector(direction).detect(new Series(values), flat, 2.5);
    }

    @Test
    void oneRecordPerPointAfterBurnIn() throws Exception {
        Series shortSeries = new SeriesSimulator().generate(200, 5).getSeries();
        int[][] orders = {{1, 0, 0}, {2, 1, 0}, {5, 1, 0}, {3, 2, 0}, {2, 0, 0}};
        for (int[] o : orders) {
            ModelOrder order = ModelOrder.of(o[0], o[1], o[2]);
            FittedModel fitted = new AutoregressiveModel().fit(shortSeries, order);
            List<AnomalyRecord> records = new AnomalyDetector().detect(shortSeries, fitted);
            assertEquals(200 - (o[0] + o[1]), records.size(), "order " + order);
            for (int i = 0; i < records.size(); i++) {
                assertEquals(o[0] + o[1] + i, records.get(i).getTimestamp());
                assertEquals(shortSeries.getValue((int) records.get(i).getTimestamp()), records.get(i).getActual(), 0.0);
            }
        }
    }

    @Test
    void smallestValidSeriesGivesOneRecord() throws Exception {
        Series tiny = new Series(new double[]{40, 42, 41, 45, 43, 44, 47});
        FittedModel fitted = new AutoregressiveModel().fit(tiny, ModelOrder.of(5, 1, 0));
        List<AnomalyRecord> records = new AnomalyDetector().detect(tiny, fitted);
        assertEquals(1, records.size());
        assertEquals(6, records.get(0).getTimestamp());
        assertFalse(records.get(0).isAnomaly());
    }

    @Test
    void residualIsActualMinusPredicted() throws Exception {
        for (AnomalyRecord record : new AnomalyDetector().detect(series, model)) {
            assertEquals(record.getActual() - record.getPredicted(), record.getResidual(), 1e-12);
        }
    }

    @Test
    void thresholdEqualityIsNotAnAnomaly() throws Exception {
        AnomalyDetector detector = new AnomalyDetector();
        List<AnomalyRecord> records = detector.detect(series, model, 2.5);
        double maxZ = 0.0;
        int maxIdx = -1;
        for (int i = 0; i < records.size(); i++) {
            if (Math.abs(records.get(i).getZScore()) > maxZ) {
                maxZ = Math.abs(records.get(i).getZScore());
                maxIdx = i;
            }
        }

        List<AnomalyRecord> atMax = detector.detect(series, model, maxZ);
        assertEquals(Math.abs(atMax.get(maxIdx).getZScore()), maxZ, 0.0);
        assertFalse(atMax.get(maxIdx).isAnomaly());
        assertEquals(0, AnomalyDetector.anomaliesOnly(atMax).size());

        List<AnomalyRecord> belowMax = detector.detect(series, model, maxZ - 1e-9);
        assertTrue(belowMax.get(maxIdx).isAnomaly());
    }

    @Test
    void comparisonIsStrict() {
        AnomalyDetector detector = new AnomalyDetector();
        assertFalse(detector.isAnomaly(2.5, 2.5));
        assertFalse(detector.isAnomaly(-2.5, 2.5));
        assertTrue(detector.isAnomaly(Math.nextUp(2.5), 2.5));
        assertTrue(detector.isAnomaly(-2.5 - 1e-12, 2.5));
    }

    @Test
    void zeroVarianceFlagsNothing() throws Exception {
        double[] values = new double[50];
        for (int i = 0; i < values.length; i++)
            values[i] = 2.0 * i;
        Series linear = new Series(values);
        FittedModel randomWalk = new AutoregressiveModel().fit(linear, ModelOrder.of(0, 1, 0));

        List<AnomalyRecord> records = new AnomalyDetector().detect(linear, randomWalk, 0.001);
        assertEquals(49, records.size());
        for (AnomalyRecord record : records) {
            assertEquals(2.0, record.getResidual(), 0.0);
            assertEquals(0.0, record.getZScore(), 0.0);
            assertFalse(record.isAnomaly());
        }
    }

    @Test
    void noiselessRampFitFlagsNothing() throws Exception {
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++)
            values[i] = 0.3 * i + 0.1;
        Series ramp = new Series(values);
        FittedModel fitted = new AutoregressiveModel().fit(ramp, ModelOrder.of(2, 1, 0));

        List<AnomalyRecord> records = new AnomalyDetector().detect(ramp, fitted, 2.5);
        assertEquals(97, records.size());
        assertEquals(0, AnomalyDetector.anomaliesOnly(records).size());
        for (AnomalyRecord record : records)
            assertEquals(0.0, record.getZScore(), 0.0);
    }

    @Test
    void detectIsIdempotent() throws Exception {
        AnomalyDetector detector = new AnomalyDetector();
        assertEquals(detector.detect(series, model, 2.5), detector.detect(series, model, 2.5));
    }

    @Test
    void directionSelectsSpikesOrDrops() throws Exception {
        List<AnomalyRecord> both = spikeAndDrop(AnomalyDirection.UPDOWN);
        assertEquals(100, both.size());
        assertTrue(both.get(30).isAnomaly());
        assertTrue(both.get(60).isAnomaly());
        assertEquals(2, AnomalyDetector.anomaliesOnly(both).size());

        List<AnomalyRecord> up = AnomalyDetector.anomaliesOnly(spikeAndDrop(AnomalyDirection.UP));
        assertEquals(1, up.size());
        assertEquals(30, up.get(0).getTimestamp());

        List<AnomalyRecord> down = AnomalyDetector.anomaliesOnly(spikeAndDrop(AnomalyDirection.DOWN));
        assertEquals(1, down.size());
        assertEquals(60, down.get(0).getTimestamp());
        assertTrue(down.get(0).getZScore() < 0);
    }

    @Test
    void nonPositiveThresholdIsRejected() {
        AnomalyDetector detector = new AnomalyDetector();
        assertThrows(InvalidConfigurationException.class, () -> detector.detect(series, model, 0.0));
        assertThrows(InvalidConfigurationException.class, () -> detector.detect(series, model, -1.0));
        assertThrows(InvalidConfigurationException.class, () -> detector.detect(series, model, Double.NaN));
    }

    @Test
    void seriesShorterThanBurnInIsRejected() {
        assertThrows(InsufficientDataException.class,
                () -> new AnomalyDetector().detect(new Series(new double[]{1, 2, 3}), model));
    }
}
