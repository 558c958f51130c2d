package com.lanewatch.backend.model.report;

import java.util.List;

/**
 * Everything the core derived from one frame.
 */
public class FrameAnalysis {
    private final long frameId;
    private final long timestampMillis;
    private final int observedVehicles;
    private final int vehicleCount;
    private final List<LaneReport> lanes;
    private final List<ActiveIncident> incidents;
    private final List<SpeedViolation> violations;
    private final EmergencyState emergency;
    private final SignalPhase signal;

    public FrameAnalysis(long frameId, long timestampMillis, int observedVehicles, List<LaneReport> lanes,
                         List<ActiveIncident> incidents, List<SpeedViolation> violations,
                         EmergencyState emergency, SignalPhase signal) {
        this.frameId = frameId;
        this.timestampMillis = timestampMillis;
        this.observedVehicles = observedVehicles;
        this.lanes = List.copyOf(lanes);
        this.incidents = List.copyOf(incidents);
        this.violations = List.copyOf(violations);
        this.emergency = emergency;
        this.signal = signal;
        this.vehicleCount = this.lanes.stream().mapToInt(LaneReport::getTotal).sum();
    }

    public LaneReport lane(int laneId) {
        return lanes.stream()
                .filter(l -> l.getLaneId() == laneId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown lane " + laneId));
    }

    public long getFrameId() { return frameId; }
    public long getTimestampMillis() { return timestampMillis; }
    /** All vehicles in the frame, including those outside every lane. */
    public int getObservedVehicles() { return observedVehicles; }
    /** Vehicles counted in some lane. */
    public int getVehicleCount() { return vehicleCount; }
    public List<LaneReport> getLanes() { return lanes; }
    public List<ActiveIncident> getIncidents() { return incidents; }
    public List<SpeedViolation> getViolations() { return violations; }
    public EmergencyState getEmergency() { return emergency; }
    public SignalPhase getSignal() { return signal; }
}
