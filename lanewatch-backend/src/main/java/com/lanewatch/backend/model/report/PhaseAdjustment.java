package com.lanewatch.backend.model.report;

/**
 * Mid-phase trims applied to the active green.
 */
public enum PhaseAdjustment {
    EMERGENCY("EMERGENCY DETECTED | Green shortened"),
    CONGESTION("CONGESTION | Green shortened");

    private final String banner;

    PhaseAdjustment(String banner) {
        this.banner = banner;
    }

    public String getBanner() { return banner; }
}
