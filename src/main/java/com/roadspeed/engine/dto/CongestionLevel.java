package com.roadspeed.engine.dto;

/**
 * Speed bands used to colour segments on a traffic map.
 *
 * Thresholds are lower bounds in km/h, checked from the fastest band down.
 */
public enum CongestionLevel {

    FREE_FLOW(45.0, "#2E7D32"),
    MODERATE(30.0, "#F9A825"),
    SLOW(15.0, "#EF6C00"),
    CONGESTED(0.0, "#C62828"),
    UNKNOWN(Double.NaN, "#888888");

    private final double minSpeedKmh;
    private final String color;

    CongestionLevel(double minSpeedKmh, String color) {
        this.minSpeedKmh = minSpeedKmh;
        this.color = color;
    }

    public String color() {
        return color;
    }

    /**
     * Classifies a speed. Absent or non-finite speeds are {@link #UNKNOWN}.
     */
    public static CongestionLevel classify(Double speedKmh) {
        if (speedKmh == null || speedKmh.isNaN() || speedKmh.isInfinite()) {
            return UNKNOWN;
        }
        if (speedKmh >= FREE_FLOW.minSpeedKmh) return FREE_FLOW;
        if (speedKmh >= MODERATE.minSpeedKmh) return MODERATE;
        if (speedKmh >= SLOW.minSpeedKmh) return SLOW;
        return CONGESTED;
    }
}
