package com.lanewatch.backend.model;

/**
 * Level of service for a lane, graded from its current occupancy
 * (simplified Highway Capacity Manual bands).
 */
public enum LosGrade {
    A(3, "#4ade80", "Free flow"),
    B(6, "#a3e635", "Reasonable free flow"),
    C(10, "#facc15", "Stable flow"),
    D(15, "#fb923c", "Approaching unstable"),
    E(22, "#f87171", "Unstable flow"),
    F(Integer.MAX_VALUE, "#dc2626", "Forced / breakdown");

    private final int maxOccupancy;
    private final String color;
    private final String description;

    LosGrade(int maxOccupancy, String color, String description) {
        this.maxOccupancy = maxOccupancy;
        this.color = color;
        this.description = description;
    }

    /**
     * Step function over inclusive upper bounds. Negative counts grade as A.
     */
    public static LosGrade forOccupancy(int vehicleCount) {
        for (LosGrade grade : values()) {
            if (vehicleCount <= grade.maxOccupancy) {
                return grade;
            }
        }
        return F;
    }

    public String getColor() { return color; }
    public String getDescription() { return description; }
}
