package com.lanewatch.backend.service.signal;

/**
 * Ranking of a waiting lane for the next green.
 * <p>
 * A forced score (the lane hit the starvation ceiling) ranks above every numeric
 * score. Forced scores compare by how long the lane has waited.
 */
public final class PriorityScore implements Comparable<PriorityScore> {

    private final boolean forced;
    private final double value;

    private PriorityScore(boolean forced, double value) {
        this.forced = forced;
        this.value = value;
    }

    public static PriorityScore of(double score) {
        return new PriorityScore(false, score);
    }

    public static PriorityScore forced(double waitedSeconds) {
        return new PriorityScore(true, waitedSeconds);
    }

    public boolean isForced() {
        return forced;
    }

    /** The numeric score, or the waited seconds for a forced score. */
    public double getValue() {
        return value;
    }

    @Override
    public int compareTo(PriorityScore other) {
        if (forced != other.forced) {
            return forced ? 1 : -1;
        }
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return forced ? String.format("FORCED(waited %.1fs)", value) : String.format("%.2f", value);
    }
}
