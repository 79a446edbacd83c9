package com.mist.anomaly;

/**
 * One hourly observation.  The timestamp is the ordinal hour index inside its series.
 */
public final class TimePoint {
    private final long timestamp;
    private final double value;

    public TimePoint(long timestamp, double value) {
        assert timestamp >= 0 : "TimePoint: timestamp cannot be negative";
        this.timestamp = timestamp;
        this.value = value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimePoint)) return false;
        TimePoint other = (TimePoint) o;
        return timestamp == other.timestamp && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(timestamp) + Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "TimePoint [timestamp=" + timestamp + ", value=" + value + "]";
    }
}
