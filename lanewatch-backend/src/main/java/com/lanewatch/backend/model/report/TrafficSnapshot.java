package com.lanewatch.backend.model.report;

import java.util.List;

/**
 * Immutable state published once per frame to readers (REST, STOMP).
 */
public class TrafficSnapshot {
    private final FrameAnalysis frame;
    private final List<SpeedViolation> recentViolations;
    private final List<HistorySample> history;
    private final SessionSummary session;

    public TrafficSnapshot(FrameAnalysis frame, List<SpeedViolation> recentViolations,
                           List<HistorySample> history, SessionSummary session) {
        this.frame = frame;
        this.recentViolations = List.copyOf(recentViolations);
        this.history = List.copyOf(history);
        this.session = session;
    }

    public FrameAnalysis getFrame() { return frame; }
    public List<SpeedViolation> getRecentViolations() { return recentViolations; }
    public List<HistorySample> getHistory() { return history; }
    public SessionSummary getSession() { return session; }
}
