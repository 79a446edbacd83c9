package com.mist.anomaly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A generated series together with the events injected into it.  The injected indices are ground truth for
 * validation and must never be handed to the detector.
 */
public final class Simulation {
    public enum InjectionKind {SPIKE, DROP}

    private final Series series;
    private final Map<Integer, InjectionKind> injected;

    public Simulation(Series series, Map<Integer, InjectionKind> injected) {
        this.series = series;
        this.injected = Collections.unmodifiableMap(new TreeMap<Integer, InjectionKind>(injected));
    }

    public Series getSeries() {
        return series;
    }

    /**
     * @return injected indices in ascending order, with the kind of event at each
     */
    public Map<Integer, InjectionKind> getInjected() {
        return injected;
    }

    public List<Integer> getInjectedIndices() {
        return Collections.unmodifiableList(new ArrayList<Integer>(injected.keySet()));
    }
}
