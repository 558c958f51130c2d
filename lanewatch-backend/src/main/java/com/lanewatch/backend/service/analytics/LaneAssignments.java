package com.lanewatch.backend.service.analytics;

import com.lanewatch.backend.model.lane.Lane;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sticky vehicle-to-lane assignment. A vehicle whose centroid falls outside every
 * lane keeps the last lane it was seen in, which suppresses jitter at lane borders.
 */
public class LaneAssignments {

    private final LaneIndex laneIndex;
    private final Map<Integer, Integer> lastKnownLane = new HashMap<>();

    public LaneAssignments(LaneIndex laneIndex) {
        this.laneIndex = laneIndex;
    }

    /**
     * @return the lane index for this vehicle, or null if it has never been inside a lane
     */
    public Integer resolve(int trackId, double x, double y) {
        Optional<Lane> lane = laneIndex.locate(x, y);
        if (lane.isPresent()) {
            lastKnownLane.put(trackId, lane.get().getIndex());
            return lane.get().getIndex();
        }
        return lastKnownLane.get(trackId);
    }

    public void retainActive(Set<Integer> activeIds) {
        lastKnownLane.keySet().retainAll(activeIds);
    }

    public int size() {
        return lastKnownLane.size();
    }
}
