package com.lanewatch.backend.service.analytics;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flags vehicles that have not moved beyond a pixel tolerance for a configured time.
 * <p>
 * A vehicle is either moving or stationary. The stationary clock starts at the last
 * position where it moved by more than the tolerance (or where it was first seen)
 * and any later move past the tolerance resets it immediately.
 */
public class IncidentDetector {

    private final long timeoutMillis;
    private final double tolerancePixels;
    private final Map<Integer, StillRecord> records = new HashMap<>();

    public IncidentDetector(double timeoutSeconds, double tolerancePixels) {
        this.timeoutMillis = Math.round(timeoutSeconds * 1000);
        this.tolerancePixels = tolerancePixels;
    }

    /**
     * @return true while the vehicle has been still for at least the timeout
     */
    public boolean update(int trackId, double x, double y, int laneId, long nowMillis) {
        StillRecord prev = records.get(trackId);
        if (prev == null) {
            records.put(trackId, new StillRecord(x, y, nowMillis, laneId));
            return false;
        }
        double dist = Math.hypot(x - prev.x, y - prev.y);
        if (dist > tolerancePixels) {
            records.put(trackId, new StillRecord(x, y, nowMillis, laneId));
            return false;
        }
        return nowMillis - prev.stillSinceMillis >= timeoutMillis;
    }

    public double stillSeconds(int trackId, long nowMillis) {
        StillRecord record = records.get(trackId);
        return record == null ? 0.0 : (nowMillis - record.stillSinceMillis) / 1000.0;
    }

    public Integer laneOf(int trackId) {
        StillRecord record = records.get(trackId);
        return record == null ? null : record.laneId;
    }

    public void retainActive(Set<Integer> activeIds) {
        records.keySet().retainAll(activeIds);
    }

    public int trackedVehicles() {
        return records.size();
    }

    private static final class StillRecord {
        final double x;
        final double y;
        final long stillSinceMillis;
        final int laneId;

        StillRecord(double x, double y, long stillSinceMillis, int laneId) {
            this.x = x;
            this.y = y;
            this.stillSinceMillis = stillSinceMillis;
            this.laneId = laneId;
        }
    }
}
