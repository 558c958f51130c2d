package com.lanewatch.backend.service.signal;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-lane occupancy and trend slope for the current frame, as seen by the scheduler.
 */
public class LaneDemand {

    private final Map<Integer, Integer> occupancy;
    private final Map<Integer, Double> slope;

    public LaneDemand(Map<Integer, Integer> occupancy, Map<Integer, Double> slope) {
        this.occupancy = new HashMap<>(occupancy);
        this.slope = new HashMap<>(slope);
    }

    public int occupancy(int lane) {
        return occupancy.getOrDefault(lane, 0);
    }

    public double slope(int lane) {
        return slope.getOrDefault(lane, 0.0);
    }

    /** Highest occupancy among lanes 1..laneCount other than {@code excluded}, 0 if none. */
    public int maxOccupancyExcept(int excluded, int laneCount) {
        int max = 0;
        for (int lane = 1; lane <= laneCount; lane++) {
            if (lane != excluded) {
                max = Math.max(max, occupancy(lane));
            }
        }
        return max;
    }
}
