package com.lanewatch.backend.service;

import com.lanewatch.backend.config.TrafficProperties;
import com.lanewatch.backend.model.LosGrade;
import com.lanewatch.backend.model.lane.Lane;
import com.lanewatch.backend.model.report.ActiveIncident;
import com.lanewatch.backend.model.report.EmergencyState;
import com.lanewatch.backend.model.report.FrameAnalysis;
import com.lanewatch.backend.model.report.LaneReport;
import com.lanewatch.backend.model.report.SessionSummary;
import com.lanewatch.backend.model.report.SignalPhase;
import com.lanewatch.backend.model.report.SpeedViolation;
import com.lanewatch.backend.model.vehicle.VehicleClass;
import com.lanewatch.backend.model.vehicle.VehicleObservation;
import com.lanewatch.backend.service.analytics.FlowRateTracker;
import com.lanewatch.backend.service.analytics.IncidentDetector;
import com.lanewatch.backend.service.analytics.LaneAssignments;
import com.lanewatch.backend.service.analytics.LaneIndex;
import com.lanewatch.backend.service.analytics.LaneTrendTracker;
import com.lanewatch.backend.service.analytics.PositionHistory;
import com.lanewatch.backend.service.analytics.SessionAggregator;
import com.lanewatch.backend.service.analytics.SpeedCamera;
import com.lanewatch.backend.service.signal.LaneDemand;
import com.lanewatch.backend.service.signal.SignalPhaseState;
import com.lanewatch.backend.service.signal.SignalPriorityScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-frame analytics pipeline and owner of all rolling state.
 * <p>
 * Not thread-safe: frames must be fed by a single writer in timestamp order.
 * {@link TrafficMonitorService} serializes access.
 */
@Slf4j
public class TrafficAnalysisEngine {

    private final LaneIndex laneIndex;
    private final LaneAssignments assignments;
    private final PositionHistory positions;
    private final IncidentDetector incidentDetector;
    private final SpeedCamera speedCamera;
    private final FlowRateTracker flowTracker;
    private final LaneTrendTracker trendTracker;
    private final SignalPriorityScheduler scheduler;
    private final SignalPhaseState phaseState;
    private final SessionAggregator session;

    private long frameId;
    private long lastTimestampMillis = Long.MIN_VALUE;

    public TrafficAnalysisEngine(TrafficProperties properties, List<Lane> lanes, long sessionStartMillis) {
        properties.validate();
        this.laneIndex = new LaneIndex(lanes);
        this.assignments = new LaneAssignments(laneIndex);
        this.positions = new PositionHistory(properties.getPositionHistorySize(), properties.getPixelToMeter());
        this.incidentDetector = new IncidentDetector(
                properties.getIncident().getTimeoutSeconds(), properties.getIncident().getTolerancePixels());
        this.speedCamera = new SpeedCamera(
                properties.getSpeed().getLimitKmh(),
                properties.getSpeed().getEmergencyKmh(),
                properties.getSpeed().getEmergencyClasses());
        this.flowTracker = new FlowRateTracker(properties.getFlow().getHorizonSeconds());
        this.trendTracker = new LaneTrendTracker(properties.getTrend().getWindow(), properties.getTrend().getThreshold());
        this.scheduler = new SignalPriorityScheduler(properties.getSignal());
        this.phaseState = new SignalPhaseState(laneIndex.size());
        this.session = new SessionAggregator(sessionStartMillis);
    }

    /**
     * Runs every analytic over one frame's tracked vehicles and steps the signal controller.
     *
     * @throws IllegalArgumentException if the timestamp is older than the previous frame's
     */
    public FrameAnalysis processFrame(List<VehicleObservation> observations, long nowMillis) {
        if (nowMillis < lastTimestampMillis) {
            throw new IllegalArgumentException("Frame timestamp " + nowMillis
                    + " precedes previous frame at " + lastTimestampMillis);
        }
        lastTimestampMillis = nowMillis;
        frameId++;

        int laneCount = laneIndex.size();
        Map<Integer, EnumMap<VehicleClass, Integer>> laneCounts = new LinkedHashMap<>();
        for (int lane = 1; lane <= laneCount; lane++) {
            laneCounts.put(lane, new EnumMap<>(VehicleClass.class));
        }

        Set<Integer> activeIds = new HashSet<>();
        List<ActiveIncident> incidents = new ArrayList<>();
        List<SpeedViolation> violations = new ArrayList<>();
        Integer emergencyLane = null;

        for (VehicleObservation v : observations) {
            int id = v.getTrackId();
            double cx = v.getCentroidX();
            double cy = v.getCentroidY();
            activeIds.add(id);

            Integer lane = assignments.resolve(id, cx, cy);
            if (lane != null) {
                laneCounts.get(lane).merge(v.getVehicleClass(), 1, Integer::sum);
            }

            positions.record(id, cx, cy, nowMillis);
            double speedKmh = positions.speedKmh(id);

            speedCamera.check(id, lane, speedKmh, v.getVehicleClass(), nowMillis).ifPresent(violations::add);

            // Last qualifying vehicle in observation order wins
            if (speedCamera.isEmergencyCandidate(v.getVehicleClass(), speedKmh, lane)) {
                if (emergencyLane != null && !emergencyLane.equals(lane)) {
                    log.debug("Emergency candidates in lanes {} and {}, keeping lane {}", emergencyLane, lane, lane);
                }
                emergencyLane = lane;
            }

            if (lane != null) {
                if (incidentDetector.update(id, cx, cy, lane, nowMillis)) {
                    double duration = Math.round(incidentDetector.stillSeconds(id, nowMillis) * 10.0) / 10.0;
                    incidents.add(new ActiveIncident(id, lane, cx, cy, duration));
                }
                flowTracker.record(lane, id, nowMillis);
            }
        }

        incidentDetector.retainActive(activeIds);
        positions.retainActive(activeIds);
        assignments.retainActive(activeIds);
        speedCamera.retainActive(activeIds);

        Map<Integer, Integer> occupancy = new HashMap<>();
        Map<Integer, Double> slopes = new HashMap<>();
        List<LaneReport> reports = new ArrayList<>(laneCount);
        for (Map.Entry<Integer, EnumMap<VehicleClass, Integer>> entry : laneCounts.entrySet()) {
            int lane = entry.getKey();
            int total = entry.getValue().values().stream().mapToInt(Integer::intValue).sum();
            trendTracker.update(lane, total);
            double slope = trendTracker.slope(lane);
            occupancy.put(lane, total);
            slopes.put(lane, slope);
            reports.add(new LaneReport(lane, entry.getValue(), LosGrade.forOccupancy(total),
                    trendTracker.direction(lane), slope, flowTracker.rate(lane, nowMillis)));
        }

        SignalPhase signal = scheduler.update(phaseState, new LaneDemand(occupancy, slopes), emergencyLane, nowMillis);

        FrameAnalysis frame = new FrameAnalysis(frameId, nowMillis, observations.size(), reports, incidents,
                violations, emergencyLane == null ? EmergencyState.INACTIVE : new EmergencyState(emergencyLane),
                signal);
        session.fold(frame, activeIds);

        if (log.isDebugEnabled()) {
            log.debug("Frame {}: {} observed, {} in lanes, {} incidents, lane {} green ({}s left)",
                    frameId, observations.size(), frame.getVehicleCount(), incidents.size(),
                    signal.getActiveLane(), signal.getRemainingSeconds());
        }
        return frame;
    }

    public SessionSummary sessionSummary(long nowMillis) {
        return session.summary(nowMillis);
    }

    public List<Lane> getLanes() {
        return laneIndex.getLanes();
    }

    public long getFrameId() {
        return frameId;
    }
}
