package com.mist.anomaly.report;

import com.mist.anomaly.AnomalyRecord;
import com.mist.anomaly.Series;
import org.apache.log4j.Logger;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.BitmapEncoder.BitmapFormat;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.lines.SeriesLines;
import org.knowm.xchart.style.markers.SeriesMarkers;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Actual vs predicted CPU utilization with the flagged points highlighted.
 */
public class DetectionChart {
    private static final Logger logger = Logger.getLogger(DetectionChart.class);

    public static final String ACTUAL = "Actual CPU %";
    public static final String PREDICTED = "ARIMA Predicted";
    public static final String ANOMALIES = "Anomaly Detected";

    public static XYChart build(Series series, List<AnomalyRecord> records, double sigmaThreshold) {
        ArrayList<Date> dataX = new ArrayList<Date>();
        ArrayList<Double> dataY = new ArrayList<Double>();
        for (int i = 0; i < series.size(); i++) {
            dataX.add(series.timeOf(i).toDate());
            dataY.add(series.getValue(i));
        }

        ArrayList<Date> predictX = new ArrayList<Date>();
        ArrayList<Double> predictY = new ArrayList<Double>();
        ArrayList<Date> anomalyX = new ArrayList<Date>();
        ArrayList<Double> anomalyY = new ArrayList<Double>();
        for (AnomalyRecord record : records) {
            Date time = series.timeOf(record.getTimestamp()).toDate();
            predictX.add(time);
            predictY.add(record.getPredicted());
            if (record.isAnomaly()) {
                anomalyX.add(time);
                anomalyY.add(record.getActual());
            }
        }

        XYChart chart = new XYChartBuilder().width(1400).height(700)
                .title("Server CPU Anomaly Detection (ARIMA) | Threshold: " + sigmaThreshold
                        + " Sigma | Anomalies Found: " + anomalyX.size())
                .xAxisTitle("Timestamp").yAxisTitle("CPU Utilization (%)").build();

        XYSeries actualSeries = chart.addSeries(ACTUAL, dataX, dataY);
        actualSeries.setLineColor(new Color(0x1f, 0x77, 0xb4));
        actualSeries.setMarker(SeriesMarkers.NONE);
        if (!predictX.isEmpty()) {
            XYSeries predictSeries = chart.addSeries(PREDICTED, predictX, predictY);
            predictSeries.setLineColor(new Color(0xff, 0x7f, 0x0e));
            predictSeries.setLineStyle(SeriesLines.DASH_DASH);
            predictSeries.setMarker(SeriesMarkers.NONE);
        }
        // xchart rejects empty series
        if (!anomalyX.isEmpty()) {
            XYSeries anomalySeries = chart.addSeries(ANOMALIES, anomalyX, anomalyY);
            anomalySeries.setXYSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Scatter);
            anomalySeries.setMarker(SeriesMarkers.CIRCLE);
            anomalySeries.setMarkerColor(Color.RED);
        }

        chart.getStyler().setMarkerSize(10);
        chart.getStyler().setDatePattern("MM-dd HH:mm");
        return chart;
    }

    /**
     * Render the chart as PNG.
     */
    public static void save(XYChart chart, Path path) throws IOException {
        if (path.getParent() != null)
            Files.createDirectories(path.getParent());
        BitmapEncoder.saveBitmap(chart, path.toString(), BitmapFormat.PNG);
        logger.debug("Saved chart to " + path);
    }
}
