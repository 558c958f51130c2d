package com.lanewatch.backend.service.analytics;

import com.lanewatch.backend.model.TrendDirection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Rolling linear-regression slope of lane occupancy. One sample per frame,
 * indexed by sample number rather than wall time.
 */
public class LaneTrendTracker {

    private final int window;
    private final double threshold;
    private final Map<Integer, Deque<Integer>> history = new HashMap<>();

    public LaneTrendTracker(int window, double threshold) {
        this.window = window;
        this.threshold = threshold;
    }

    public void update(int laneId, int count) {
        Deque<Integer> samples = history.computeIfAbsent(laneId, k -> new ArrayDeque<>(window));
        samples.addLast(count);
        while (samples.size() > window) {
            samples.removeFirst();
        }
    }

    /**
     * Least-squares slope in vehicles per sample; 0 until three samples exist.
     */
    public double slope(int laneId) {
        Deque<Integer> samples = history.get(laneId);
        if (samples == null || samples.size() < 3) {
            return 0.0;
        }
        int n = samples.size();
        double mx = (n - 1) / 2.0;
        double my = 0;
        for (int y : samples) {
            my += y;
        }
        my /= n;

        double num = 0;
        double den = 0;
        int x = 0;
        for (int y : samples) {
            num += (x - mx) * (y - my);
            den += (x - mx) * (x - mx);
            x++;
        }
        return num / den;
    }

    public TrendDirection direction(int laneId) {
        return TrendDirection.fromSlope(slope(laneId), threshold);
    }

    public int sampleCount(int laneId) {
        Deque<Integer> samples = history.get(laneId);
        return samples == null ? 0 : samples.size();
    }
}
