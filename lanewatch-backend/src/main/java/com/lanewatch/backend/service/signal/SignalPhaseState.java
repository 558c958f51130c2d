package com.lanewatch.backend.service.signal;

import java.util.HashMap;
import java.util.Map;

/**
 * Mutable phase state of one intersection. Owned by a single frame pipeline and
 * changed only through {@link SignalPriorityScheduler}.
 */
public class SignalPhaseState {

    private final int laneCount;
    private final Map<Integer, Long> lastGreenMillis = new HashMap<>();
    private int activeLane = 1;
    private boolean started;
    private int phaseDurationSeconds;
    private long phaseStartMillis;
    private long phaseDeadlineMillis;
    private Long lastAdjustmentMillis;
    private long controllerStartMillis;

    public SignalPhaseState(int laneCount) {
        if (laneCount < 1) {
            throw new IllegalStateException("Signal controller needs at least one lane");
        }
        this.laneCount = laneCount;
    }

    void startPhase(int lane, int durationSeconds, long nowMillis) {
        if (!started) {
            controllerStartMillis = nowMillis;
        }
        activeLane = lane;
        started = true;
        phaseDurationSeconds = durationSeconds;
        phaseStartMillis = nowMillis;
        phaseDeadlineMillis = nowMillis + durationSeconds * 1000L;
        lastAdjustmentMillis = null;
        lastGreenMillis.put(lane, nowMillis);
    }

    void trimDeadline(long deadlineMillis, long nowMillis) {
        phaseDeadlineMillis = deadlineMillis;
        lastAdjustmentMillis = nowMillis;
    }

    public int getLaneCount() { return laneCount; }
    public int getActiveLane() { return activeLane; }
    public boolean isStarted() { return started; }
    /** Start of the very first phase. */
    public long getControllerStartMillis() { return controllerStartMillis; }
    /** Duration computed when the phase started, before any trim. */
    public int getPhaseDurationSeconds() { return phaseDurationSeconds; }
    public long getPhaseStartMillis() { return phaseStartMillis; }
    public long getPhaseDeadlineMillis() { return phaseDeadlineMillis; }
    /** Null when no trim happened in the current phase. */
    public Long getLastAdjustmentMillis() { return lastAdjustmentMillis; }

    /** Null for a lane that has never been green. */
    public Long getLastGreenMillis(int lane) {
        return lastGreenMillis.get(lane);
    }
}
