package com.lanewatch.backend.model.report;

/**
 * A vehicle that has stayed within the movement tolerance for at least the incident timeout.
 */
public class ActiveIncident {
    private final int trackId;
    private final int lane;
    private final double x;
    private final double y;
    private final double durationSeconds;

    public ActiveIncident(int trackId, int lane, double x, double y, double durationSeconds) {
        this.trackId = trackId;
        this.lane = lane;
        this.x = x;
        this.y = y;
        this.durationSeconds = durationSeconds;
    }

    public int getTrackId() { return trackId; }
    public int getLane() { return lane; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getDurationSeconds() { return durationSeconds; }
}
