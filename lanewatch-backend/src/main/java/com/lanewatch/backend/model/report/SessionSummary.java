package com.lanewatch.backend.model.report;

/**
 * Cumulative totals since the process started.
 */
public class SessionSummary {
    private final String sessionStart;
    private final long durationSeconds;
    private final int uniqueVehicles;
    private final int peakOccupancy;
    private final String peakTime;
    private final int totalIncidents;
    private final int totalViolations;

    public SessionSummary(String sessionStart, long durationSeconds, int uniqueVehicles, int peakOccupancy,
                          String peakTime, int totalIncidents, int totalViolations) {
        this.sessionStart = sessionStart;
        this.durationSeconds = durationSeconds;
        this.uniqueVehicles = uniqueVehicles;
        this.peakOccupancy = peakOccupancy;
        this.peakTime = peakTime;
        this.totalIncidents = totalIncidents;
        this.totalViolations = totalViolations;
    }

    public String getSessionStart() { return sessionStart; }
    public long getDurationSeconds() { return durationSeconds; }
    public int getUniqueVehicles() { return uniqueVehicles; }
    public int getPeakOccupancy() { return peakOccupancy; }
    /** Null until some lane held a vehicle. */
    public String getPeakTime() { return peakTime; }
    public int getTotalIncidents() { return totalIncidents; }
    public int getTotalViolations() { return totalViolations; }
}
