package com.lanewatch.backend.service.analytics;

import com.lanewatch.backend.model.report.ActiveIncident;
import com.lanewatch.backend.model.report.FrameAnalysis;
import com.lanewatch.backend.model.report.SessionSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Set;

/**
 * Process-lifetime counters folded from every frame.
 */
@Slf4j
public class SessionAggregator {

    private final long sessionStartMillis;
    private final Set<Integer> allIds = new HashSet<>();
    private final Set<Integer> openIncidents = new HashSet<>();
    private int peakOccupancy;
    private Long peakTimeMillis;
    private int totalIncidents;
    private int totalViolations;

    public SessionAggregator(long sessionStartMillis) {
        this.sessionStartMillis = sessionStartMillis;
    }

    /**
     * @param activeIds every vehicle in the frame, including those outside all lanes
     */
    public void fold(FrameAnalysis frame, Set<Integer> activeIds) {
        allIds.addAll(activeIds);

        if (frame.getVehicleCount() > peakOccupancy) {
            peakOccupancy = frame.getVehicleCount();
            peakTimeMillis = frame.getTimestampMillis();
        }

        // An incident counts once from onset until the vehicle moves again or leaves.
        Set<Integer> current = new HashSet<>();
        for (ActiveIncident incident : frame.getIncidents()) {
            current.add(incident.getTrackId());
            if (!openIncidents.contains(incident.getTrackId())) {
                totalIncidents++;
                log.warn("⚠️ Incident: vehicle {} stopped in lane {} for {}s at [{}, {}]",
                        incident.getTrackId(), incident.getLane(), incident.getDurationSeconds(),
                        incident.getX(), incident.getY());
            }
        }
        openIncidents.clear();
        openIncidents.addAll(current);

        totalViolations += frame.getViolations().size();
    }

    public SessionSummary summary(long nowMillis) {
        return new SessionSummary(
                Timestamps.iso(sessionStartMillis),
                Math.max(0, (nowMillis - sessionStartMillis) / 1000),
                allIds.size(),
                peakOccupancy,
                peakTimeMillis == null ? null : Timestamps.iso(peakTimeMillis),
                totalIncidents,
                totalViolations
        );
    }
}
