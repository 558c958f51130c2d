package com.lanewatch.backend.model.report;

import com.lanewatch.backend.model.LosGrade;
import com.lanewatch.backend.model.TrendDirection;
import com.lanewatch.backend.model.vehicle.VehicleClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-lane analytics for one frame.
 */
public class LaneReport {
    private final int laneId;
    private final Map<String, Integer> counts;
    private final int total;
    private final LosGrade los;
    private final TrendDirection trend;
    private final double trendSlope;
    private final double flowPerMinute;

    public LaneReport(int laneId, Map<VehicleClass, Integer> countsByClass, LosGrade los,
                      TrendDirection trend, double trendSlope, double flowPerMinute) {
        Map<String, Integer> labelled = new LinkedHashMap<>();
        int sum = 0;
        for (VehicleClass c : VehicleClass.values()) {
            int n = countsByClass.getOrDefault(c, 0);
            labelled.put(c.getLabel(), n);
            sum += n;
        }
        this.laneId = laneId;
        this.counts = Collections.unmodifiableMap(labelled);
        this.total = sum;
        this.los = los;
        this.trend = trend;
        this.trendSlope = trendSlope;
        this.flowPerMinute = flowPerMinute;
    }

    public int count(VehicleClass vehicleClass) {
        return counts.getOrDefault(vehicleClass.getLabel(), 0);
    }

    public LosGrade los() { return los; }
    public TrendDirection trend() { return trend; }

    // Getters for JSON
    public int getLaneId() { return laneId; }
    public Map<String, Integer> getCounts() { return counts; }
    public int getTotal() { return total; }
    public String getLosGrade() { return los.name(); }
    public String getLosColor() { return los.getColor(); }
    public String getLosDescription() { return los.getDescription(); }
    public String getTrend() { return trend.getGlyph(); }
    public String getTrendAscii() { return trend.getAscii(); }
    public int getTrendSign() { return trend.getSign(); }
    public double getTrendSlope() { return trendSlope; }
    public double getFlowPerMinute() { return flowPerMinute; }
}
