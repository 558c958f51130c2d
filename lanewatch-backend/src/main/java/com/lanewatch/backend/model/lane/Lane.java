package com.lanewatch.backend.model.lane;

/**
 * Rectangular frame region for one traffic lane. Bounds are inclusive and the
 * index is 1-based, in declaration order.
 */
public class Lane {
    private final int index;
    private final String name;
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public Lane(int index, String name, double x1, double y1, double x2, double y2) {
        if (index < 1) {
            throw new IllegalArgumentException("Lane index must be 1-based, got " + index);
        }
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException(String.format(
                    "Lane %d has inverted bounds [%.1f, %.1f, %.1f, %.1f]", index, x1, y1, x2, y2));
        }
        this.index = index;
        this.name = (name == null || name.isBlank()) ? "Lane " + index : name;
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public Lane(int index, double x1, double y1, double x2, double y2) {
        this(index, null, x1, y1, x2, y2);
    }

    public boolean contains(double x, double y) {
        return x1 <= x && x <= x2 && y1 <= y && y <= y2;
    }

    public int getIndex() { return index; }
    public String getName() { return name; }
    public double getX1() { return x1; }
    public double getY1() { return y1; }
    public double getX2() { return x2; }
    public double getY2() { return y2; }
}
