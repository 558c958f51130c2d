package com.lanewatch.backend.model.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externally visible view of the signal controller after one update.
 */
public class SignalPhase {
    private final int activeLane;
    private final int remainingSeconds;
    private final Map<Integer, Integer> estimatedWaitSeconds;
    private final PhaseAdjustment adjustment;
    private final boolean advanced;

    public SignalPhase(int activeLane, int remainingSeconds, Map<Integer, Integer> estimatedWaitSeconds,
                       PhaseAdjustment adjustment, boolean advanced) {
        this.activeLane = activeLane;
        this.remainingSeconds = remainingSeconds;
        this.estimatedWaitSeconds = Collections.unmodifiableMap(new LinkedHashMap<>(estimatedWaitSeconds));
        this.adjustment = adjustment;
        this.advanced = advanced;
    }

    public int getActiveLane() { return activeLane; }
    public int getRemainingSeconds() { return remainingSeconds; }
    /** Waiting lanes only; the active lane is absent. */
    public Map<Integer, Integer> getEstimatedWaitSeconds() { return estimatedWaitSeconds; }
    /** Trim applied during this update, or null. */
    public PhaseAdjustment getAdjustment() { return adjustment; }
    /** Dashboard banner for the trim, or null. */
    public String getAdjustmentBanner() { return adjustment == null ? null : adjustment.getBanner(); }
    /** True when this update started a new phase. */
    public boolean isAdvanced() { return advanced; }
}
