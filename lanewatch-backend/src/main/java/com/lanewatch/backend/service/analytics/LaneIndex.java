package com.lanewatch.backend.service.analytics;

import com.lanewatch.backend.model.lane.Lane;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Static lookup from a frame point to the lane containing it.
 * Lanes are assumed not to overlap; if they do, the lowest index wins.
 */
public class LaneIndex {

    private final List<Lane> lanes;

    public LaneIndex(List<Lane> lanes) {
        if (lanes == null || lanes.isEmpty()) {
            throw new IllegalStateException("No lanes configured - refusing to start lane analytics");
        }
        List<Lane> sorted = new ArrayList<>(lanes);
        sorted.sort(Comparator.comparingInt(Lane::getIndex));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).getIndex() != i + 1) {
                throw new IllegalStateException("Lane indices must run 1.." + sorted.size()
                        + " without gaps, found " + sorted.get(i).getIndex() + " at position " + (i + 1));
            }
        }
        this.lanes = Collections.unmodifiableList(sorted);
    }

    public Optional<Lane> locate(double x, double y) {
        for (Lane lane : lanes) {
            if (lane.contains(x, y)) {
                return Optional.of(lane);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return lanes.size();
    }

    public List<Lane> getLanes() {
        return lanes;
    }
}
