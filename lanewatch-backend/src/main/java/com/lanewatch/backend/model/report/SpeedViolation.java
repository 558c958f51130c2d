package com.lanewatch.backend.model.report;

import com.lanewatch.backend.model.vehicle.VehicleClass;

/**
 * Over-limit event, emitted once per vehicle per 10 km/h speed bucket.
 */
public class SpeedViolation {
    private final String timestamp;
    private final int trackId;
    private final Integer lane;
    private final double speedKmh;
    private final VehicleClass vehicleClass;

    public SpeedViolation(String timestamp, int trackId, Integer lane, double speedKmh, VehicleClass vehicleClass) {
        this.timestamp = timestamp;
        this.trackId = trackId;
        this.lane = lane;
        this.speedKmh = speedKmh;
        this.vehicleClass = vehicleClass;
    }

    public String getTimestamp() { return timestamp; }
    public int getTrackId() { return trackId; }
    /** Null when the vehicle has never been inside a lane. */
    public Integer getLane() { return lane; }
    public double getSpeedKmh() { return speedKmh; }
    public VehicleClass getVehicleClass() { return vehicleClass; }
}
