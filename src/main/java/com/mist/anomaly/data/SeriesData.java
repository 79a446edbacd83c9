package com.mist.anomaly.data;

import com.mist.anomaly.Series;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the raw hourly series as "timestamp,cpu_percent" CSV.
 */
public class SeriesData {
    private static final Logger logger = Logger.getLogger(SeriesData.class);

    public static final String HEADER = "timestamp,cpu_percent";
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").withZone(DateTimeZone.UTC);

    public static void save(Series series, Path path) throws IOException {
        if (path.getParent() != null)
            Files.createDirectories(path.getParent());
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (int i = 0; i < series.size(); i++) {
                writer.write(TIMESTAMP_FORMAT.print(series.timeOf(i)) + "," + series.getValue(i));
                writer.newLine();
            }
        }
        logger.debug("Wrote " + series.size() + " points to " + path);
    }

    /**
     * Load a series written by {@link #save}.  Rows must be consecutive hours; the first row becomes the origin.
     * @throws IOException if the file cannot be read or a row is malformed
     */
    public static Series load(Path path) throws IOException {
        List<Double> values = new ArrayList<Double>();
        DateTime origin = null;
        DateTime previous = null;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (StringUtils.isBlank(line) || (lineNo == 1 && line.trim().equals(HEADER)))
                    continue;
                String[] fields = line.split(",");
                if (fields.length != 2)
                    throw new IOException(path + ":" + lineNo + ": expected 2 fields, got " + fields.length);
                DateTime time;
                double value;
                try {
                    time = TIMESTAMP_FORMAT.parseDateTime(fields[0].trim());
                    value = Double.parseDouble(fields[1].trim());
                } catch (IllegalArgumentException e) {
                    throw new IOException(path + ":" + lineNo + ": cannot parse '" + line + "'", e);
                }
                if (previous != null && !time.isEqual(previous.plusHours(1)))
                    throw new IOException(path + ":" + lineNo + ": expected " + TIMESTAMP_FORMAT.print(previous.plusHours(1))
                            + " but found " + fields[0].trim());
                if (origin == null)
                    origin = time;
                previous = time;
                values.add(value);
            }
        }
        if (values.isEmpty())
            throw new IOException(path + ": no data rows");

        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++)
            array[i] = values.get(i);
        logger.debug("Read " + array.length + " points from " + path);
        return new Series(array, origin);
    }
}
