package com.lanewatch.backend.model.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class HistorySample {
    private final String time;
    private final Map<Integer, Integer> lanes;

    public HistorySample(String time, Map<Integer, Integer> lanes) {
        this.time = time;
        this.lanes = Collections.unmodifiableMap(new LinkedHashMap<>(lanes));
    }

    public String getTime() { return time; }
    public Map<Integer, Integer> getLanes() { return lanes; }
}
