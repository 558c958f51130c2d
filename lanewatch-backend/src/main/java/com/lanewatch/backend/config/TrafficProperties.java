package com.lanewatch.backend.config;

import com.lanewatch.backend.model.vehicle.VehicleClass;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.Set;

/**
 * Tunables for the lane analytics and the signal controller, bound from
 * {@code lanewatch.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "lanewatch")
public class TrafficProperties {

    // Classpath resource holding the lane rectangles
    private String laneLayout = "lanes.xml";

    // Linear pixel -> meter scale, set after calibration
    private double pixelToMeter = 0.05;

    // Samples kept per vehicle for speed estimation
    private int positionHistorySize = 8;

    private Speed speed = new Speed();
    private Incident incident = new Incident();
    private Trend trend = new Trend();
    private Flow flow = new Flow();
    private Reporting reporting = new Reporting();
    private Signal signal = new Signal();
    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Speed {
        private double limitKmh = 50.0;
        // Large vehicles above this are treated as emergency candidates
        private double emergencyKmh = 40.0;
        private Set<VehicleClass> emergencyClasses = EnumSet.of(VehicleClass.BUS, VehicleClass.TRUCK);
    }

    @Data
    public static class Incident {
        private double timeoutSeconds = 5.0;
        private double tolerancePixels = 15.0;
    }

    @Data
    public static class Trend {
        private int window = 20;
        private double threshold = 0.15;
    }

    @Data
    public static class Flow {
        private double horizonSeconds = 60.0;
    }

    @Data
    public static class Reporting {
        private int logEveryFrames = 30;
        private int historyEveryFrames = 90;
        private int historySize = 40;
        private int recentViolations = 10;
    }

    @Data
    public static class Signal {
        private int minPhaseSeconds = 15;
        private int maxPhaseSeconds = 90;
        private int secondsPerVehicle = 3;
        private int secondsPerSlopeUnit = 4;
        // One extra priority point per this many seconds waited
        private double waitScaleSeconds = 5.0;
        private int starvationCeilingSeconds = 120;
        private int cooldownSeconds = 25;
        private int emergencyTrimSeconds = 20;
        private int emergencyFloorSeconds = 10;
        private int congestionTrimSeconds = 10;
        private int congestionFloorSeconds = 15;
        private int minHoldSeconds = 10;
        private int clearedOccupancy = 2;
        private int congestedOccupancy = 10;
    }

    /** Credentials for the read side of the REST API. */
    @Data
    public static class Dashboard {
        private String user = "admin";
        private String password = "changeme";
    }

    /**
     * Refuses configurations the core cannot run with.
     *
     * @throws IllegalStateException describing the first bad value
     */
    public void validate() {
        require(laneLayout != null && !laneLayout.isBlank(), "lanewatch.lane-layout must be set");
        require(pixelToMeter > 0, "lanewatch.pixel-to-meter must be positive");
        require(positionHistorySize >= 2, "lanewatch.position-history-size must be at least 2");
        require(speed.limitKmh > 0, "lanewatch.speed.limit-kmh must be positive");
        require(speed.emergencyKmh > 0, "lanewatch.speed.emergency-kmh must be positive");
        require(speed.emergencyClasses != null, "lanewatch.speed.emergency-classes must be set");
        require(incident.timeoutSeconds > 0, "lanewatch.incident.timeout-seconds must be positive");
        require(incident.tolerancePixels >= 0, "lanewatch.incident.tolerance-pixels must not be negative");
        require(trend.window >= 3, "lanewatch.trend.window must be at least 3");
        require(trend.threshold >= 0, "lanewatch.trend.threshold must not be negative");
        require(flow.horizonSeconds > 0, "lanewatch.flow.horizon-seconds must be positive");
        require(reporting.logEveryFrames > 0 && reporting.historyEveryFrames > 0,
                "lanewatch.reporting cadences must be positive");
        require(reporting.historySize > 0 && reporting.recentViolations > 0,
                "lanewatch.reporting buffer sizes must be positive");
        require(signal.minPhaseSeconds > 0, "lanewatch.signal.min-phase-seconds must be positive");
        require(signal.maxPhaseSeconds >= signal.minPhaseSeconds,
                "lanewatch.signal.max-phase-seconds must not be below min-phase-seconds");
        require(signal.waitScaleSeconds > 0, "lanewatch.signal.wait-scale-seconds must be positive");
        require(signal.starvationCeilingSeconds > 0, "lanewatch.signal.starvation-ceiling-seconds must be positive");
        require(signal.cooldownSeconds >= 0, "lanewatch.signal.cooldown-seconds must not be negative");
        require(signal.emergencyTrimSeconds > 0 && signal.congestionTrimSeconds > 0,
                "lanewatch.signal trim amounts must be positive");
        require(signal.emergencyFloorSeconds >= 0 && signal.congestionFloorSeconds >= 0,
                "lanewatch.signal trim floors must not be negative");
        require(dashboard.user != null && !dashboard.user.isBlank(), "lanewatch.dashboard.user must be set");
        require(dashboard.password != null && !dashboard.password.isEmpty(),
                "lanewatch.dashboard.password must be set");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException("Invalid configuration: " + message);
        }
    }
}
