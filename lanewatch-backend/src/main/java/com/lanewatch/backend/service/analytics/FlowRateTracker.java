package com.lanewatch.backend.service.analytics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Unique vehicles per lane over a sliding time horizon, reported per minute.
 * A vehicle seen on many frames inside the horizon counts once.
 */
public class FlowRateTracker {

    private final long horizonMillis;
    private final Map<Integer, Deque<Entry>> log = new HashMap<>();

    public FlowRateTracker(double horizonSeconds) {
        this.horizonMillis = Math.round(horizonSeconds * 1000);
    }

    public void record(int laneId, int trackId, long nowMillis) {
        log.computeIfAbsent(laneId, k -> new ArrayDeque<>()).addLast(new Entry(trackId, nowMillis));
    }

    /**
     * Prunes entries older than the horizon, then returns distinct vehicles per minute
     * rounded to one decimal.
     */
    public double rate(int laneId, long nowMillis) {
        Deque<Entry> buf = log.get(laneId);
        if (buf == null) {
            return 0.0;
        }
        long cutoff = nowMillis - horizonMillis;
        while (!buf.isEmpty() && buf.peekFirst().timestampMillis < cutoff) {
            buf.removeFirst();
        }
        Set<Integer> unique = new HashSet<>();
        for (Entry e : buf) {
            unique.add(e.trackId);
        }
        double perMinute = unique.size() / (horizonMillis / 60_000.0);
        return Math.round(perMinute * 10.0) / 10.0;
    }

    public int pending(int laneId) {
        Deque<Entry> buf = log.get(laneId);
        return buf == null ? 0 : buf.size();
    }

    private static final class Entry {
        final int trackId;
        final long timestampMillis;

        Entry(int trackId, long timestampMillis) {
            this.trackId = trackId;
            this.timestampMillis = timestampMillis;
        }
    }
}
