package com.lanewatch.backend.service.analytics;

import com.lanewatch.backend.model.report.SpeedViolation;
import com.lanewatch.backend.model.vehicle.VehicleClass;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Speed-limit enforcement and emergency-vehicle heuristics.
 * <p>
 * Violations are logged once per overspeed event, not every frame: a vehicle is
 * re-reported only when its speed moves into another 10 km/h bucket.
 */
@Slf4j
public class SpeedCamera {

    private static final double BUCKET_KMH = 10.0;

    private final double limitKmh;
    private final double emergencyKmh;
    private final Set<VehicleClass> emergencyClasses;
    private final Map<Integer, Integer> loggedBuckets = new HashMap<>();

    public SpeedCamera(double limitKmh, double emergencyKmh, Set<VehicleClass> emergencyClasses) {
        this.limitKmh = limitKmh;
        this.emergencyKmh = emergencyKmh;
        this.emergencyClasses = emergencyClasses.isEmpty()
                ? EnumSet.noneOf(VehicleClass.class)
                : EnumSet.copyOf(emergencyClasses);
    }

    public Optional<SpeedViolation> check(int trackId, Integer lane, double speedKmh,
                                          VehicleClass vehicleClass, long nowMillis) {
        if (speedKmh <= limitKmh) {
            return Optional.empty();
        }
        int bucket = (int) Math.floor(speedKmh / BUCKET_KMH);
        Integer previous = loggedBuckets.put(trackId, bucket);
        if (previous != null && previous == bucket) {
            return Optional.empty();
        }
        double rounded = Math.round(speedKmh * 10.0) / 10.0;
        log.info("📷 Speeding: vehicle {} ({}) at {} km/h in lane {} (limit {})",
                trackId, vehicleClass.getLabel(), rounded, lane, limitKmh);
        return Optional.of(new SpeedViolation(Timestamps.iso(nowMillis), trackId, lane, rounded, vehicleClass));
    }

    /**
     * Fast large vehicles are used as a proxy for ambulances and fire trucks.
     */
    public boolean isEmergencyCandidate(VehicleClass vehicleClass, double speedKmh, Integer lane) {
        return lane != null && emergencyClasses.contains(vehicleClass) && speedKmh > emergencyKmh;
    }

    public void retainActive(Set<Integer> activeIds) {
        loggedBuckets.keySet().retainAll(activeIds);
    }
}
