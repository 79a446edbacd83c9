package com.mist.anomaly;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable hourly series.  Point i has timestamp i; the origin only maps that ordinal to wall-clock time when
 * the series is written out or drawn.
 */
public final class Series {
    public static final DateTime DEFAULT_ORIGIN = new DateTime(2024, 1, 1, 0, 0, DateTimeZone.UTC);

    private final double[] values;
    private final DateTime origin;

    public Series(double[] values) {
        this(values, DEFAULT_ORIGIN);
    }

    public Series(double[] values, DateTime origin) {
        assert values != null : "Series: values cannot be null";
        assert origin != null : "Series: origin cannot be null";
        this.values = values.clone();
        this.origin = origin;
    }

    public int size() {
        return values.length;
    }

    public double getValue(int index) {
        return values[index];
    }

    public TimePoint get(int index) {
        return new TimePoint(index, values[index]);
    }

    /**
     * @return a copy of the raw values, safe to modify
     */
    public double[] toArray() {
        return values.clone();
    }

    public List<TimePoint> getPoints() {
        return new AbstractList<TimePoint>() {
            @Override
            public TimePoint get(int index) {
                return Series.this.get(index);
            }

            @Override
            public int size() {
                return values.length;
            }
        };
    }

    public DateTime getOrigin() {
        return origin;
    }

    /**
     * Wall-clock time of an hour index, relative to the origin.
     */
    public DateTime timeOf(long timestamp) {
        return origin.plusHours((int) timestamp);
    }

    /**
     * @return a copy of this series with one value replaced
     */
    public Series withValue(int index, double value) {
        double[] copy = values.clone();
        copy[index] = value;
        return new Series(copy, origin);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        Series other = (Series) o;
        return Arrays.equals(values, other.values) && origin.isEqual(other.origin);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Long.hashCode(origin.getMillis());
    }

    @Override
    public String toString() {
        return "Series [size=" + values.length + ", origin=" + origin + "]";
    }
}
