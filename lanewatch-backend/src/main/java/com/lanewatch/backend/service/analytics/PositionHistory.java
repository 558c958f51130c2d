package com.lanewatch.backend.service.analytics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bounded per-vehicle centroid history used for speed estimation.
 * <p>
 * Speed is measured between the oldest and newest retained samples, so it is an
 * average over the whole window: it reacts to acceleration only after several
 * frames and smooths out single-frame bbox jitter.
 */
public class PositionHistory {

    private final int capacity;
    private final double metersPerPixel;
    private final Map<Integer, Deque<Sample>> samples = new HashMap<>();

    public PositionHistory(int capacity, double metersPerPixel) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Position history needs at least 2 samples, got " + capacity);
        }
        this.capacity = capacity;
        this.metersPerPixel = metersPerPixel;
    }

    public void record(int trackId, double x, double y, long timestampMillis) {
        Deque<Sample> history = samples.computeIfAbsent(trackId, k -> new ArrayDeque<>(capacity));
        history.addLast(new Sample(x, y, timestampMillis));
        while (history.size() > capacity) {
            history.removeFirst();
        }
    }

    /**
     * Window-averaged speed in km/h, 0 with fewer than two samples or no elapsed time.
     */
    public double speedKmh(int trackId) {
        Deque<Sample> history = samples.get(trackId);
        if (history == null || history.size() < 2) {
            return 0.0;
        }
        Sample first = history.peekFirst();
        Sample last = history.peekLast();
        double dtSeconds = (last.timestampMillis - first.timestampMillis) / 1000.0;
        if (dtSeconds <= 0) {
            return 0.0;
        }
        double distancePx = Math.hypot(last.x - first.x, last.y - first.y);
        double speedMs = distancePx * metersPerPixel / dtSeconds;
        return speedMs * 3.6;
    }

    public int sampleCount(int trackId) {
        Deque<Sample> history = samples.get(trackId);
        return history == null ? 0 : history.size();
    }

    public void retainActive(Set<Integer> activeIds) {
        samples.keySet().retainAll(activeIds);
    }

    public int trackedVehicles() {
        return samples.size();
    }

    private static final class Sample {
        final double x;
        final double y;
        final long timestampMillis;

        Sample(double x, double y, long timestampMillis) {
            this.x = x;
            this.y = y;
            this.timestampMillis = timestampMillis;
        }
    }
}
