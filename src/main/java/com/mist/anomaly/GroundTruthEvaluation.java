package com.mist.anomaly;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Scores detections against the hours the simulator tampered with.
 */
public final class GroundTruthEvaluation {
    private final List<Integer> hits;
    private final List<Integer> missed;
    private final List<Long> falseAlarms;

    private GroundTruthEvaluation(List<Integer> hits, List<Integer> missed, List<Long> falseAlarms) {
        this.hits = Collections.unmodifiableList(hits);
        this.missed = Collections.unmodifiableList(missed);
        this.falseAlarms = Collections.unmodifiableList(falseAlarms);
    }

    public static GroundTruthEvaluation evaluate(List<AnomalyRecord> records, Collection<Integer> injectedIndices) {
        TreeSet<Long> flagged = new TreeSet<Long>();
        for (AnomalyRecord record : records)
            if (record.isAnomaly())
                flagged.add(record.getTimestamp());

        TreeSet<Integer> injected = new TreeSet<Integer>(injectedIndices);
        List<Integer> hits = new ArrayList<Integer>();
        List<Integer> missed = new ArrayList<Integer>();
        for (Integer idx : injected) {
            if (flagged.contains(idx.longValue()))
                hits.add(idx);
            else
                missed.add(idx);
        }
        List<Long> falseAlarms = new ArrayList<Long>();
        for (Long ts : flagged)
            if (!injected.contains((int) ts.longValue()))
                falseAlarms.add(ts);
        return new GroundTruthEvaluation(hits, missed, falseAlarms);
    }

    public List<Integer> getHits() {
        return hits;
    }

    public List<Integer> getMissed() {
        return missed;
    }

    public List<Long> getFalseAlarms() {
        return falseAlarms;
    }

    /**
     * @return share of injected events that were flagged; 1.0 when nothing was injected
     */
    public double getRecall() {
        int injected = hits.size() + missed.size();
        return injected == 0 ? 1.0 : (double) hits.size() / injected;
    }

    /**
     * @return share of flagged points that were injected events; 1.0 when nothing was flagged
     */
    public double getPrecision() {
        int flagged = hits.size() + falseAlarms.size();
        return flagged == 0 ? 1.0 : (double) hits.size() / flagged;
    }

    @Override
    public String toString() {
        return "GroundTruthEvaluation [hits=" + hits + ", missed=" + missed + ", falseAlarms=" + falseAlarms.size()
                + ", recall=" + getRecall() + ", precision=" + getPrecision() + "]";
    }
}
