package com.mist.anomaly.report;

import com.mist.anomaly.AnomalyRecord;
import com.mist.anomaly.Series;
import com.mist.anomaly.data.SeriesData;
import org.apache.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes detection records as CSV, one row per record.
 */
public class AnomalyReporter {
    private static final Logger logger = Logger.getLogger(AnomalyReporter.class);

    public static final String HEADER = "timestamp,actual,predicted,residual,z_score,is_anomaly";

    private final boolean anomaliesOnly;

    /**
     * @param anomaliesOnly write only flagged records instead of every record
     */
    public AnomalyReporter(boolean anomaliesOnly) {
        this.anomaliesOnly = anomaliesOnly;
    }

    /**
     * @param series the detected series, used to print wall-clock timestamps
     * @return number of rows written, header excluded
     */
    public int write(Series series, List<AnomalyRecord> records, Path path) throws IOException {
        if (path.getParent() != null)
            Files.createDirectories(path.getParent());
        int rows = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (AnomalyRecord record : records) {
                if (anomaliesOnly && !record.isAnomaly())
                    continue;
                writer.write(formatRow(series, record));
                writer.newLine();
                rows++;
            }
        }
        logger.debug("Wrote " + rows + " report rows to " + path);
        return rows;
    }

    static String formatRow(Series series, AnomalyRecord record) {
        return SeriesData.TIMESTAMP_FORMAT.print(series.timeOf(record.getTimestamp())) + ","
                + record.getActual() + ","
                + record.getPredicted() + ","
                + record.getResidual() + ","
                + record.getZScore() + ","
                + record.isAnomaly();
    }

    public boolean isAnomaliesOnly() {
        return anomaliesOnly;
    }
}
