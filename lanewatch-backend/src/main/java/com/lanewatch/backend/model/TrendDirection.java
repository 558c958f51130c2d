package com.lanewatch.backend.model;

public enum TrendDirection {
    RISING("↑", "^", 1),
    FALLING("↓", "v", -1),
    STABLE("→", "-", 0);

    private final String glyph;
    private final String ascii;
    private final int sign;

    TrendDirection(String glyph, String ascii, int sign) {
        this.glyph = glyph;
        this.ascii = ascii;
        this.sign = sign;
    }

    public static TrendDirection fromSlope(double slope, double threshold) {
        if (slope > threshold) return RISING;
        if (slope < -threshold) return FALLING;
        return STABLE;
    }

    /** Arrow for dashboards. */
    public String getGlyph() { return glyph; }

    /** Arrow for renderers without unicode support. */
    public String getAscii() { return ascii; }

    public int getSign() { return sign; }
}
