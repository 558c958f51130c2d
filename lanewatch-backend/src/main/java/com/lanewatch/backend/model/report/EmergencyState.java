package com.lanewatch.backend.model.report;

public class EmergencyState {
    public static final EmergencyState INACTIVE = new EmergencyState(null);

    private final Integer lane;

    public EmergencyState(Integer lane) {
        this.lane = lane;
    }

    public boolean isActive() { return lane != null; }
    public Integer getLane() { return lane; }
}
