package com.structural.topology.model;

/**
 * Derived scalar quantities reported alongside the geometry.
 */
public enum Measure {
    PANEL_WIDTH,
    OVERALL_LENGTH,
    OVERALL_HEIGHT,
    FRAME_STATIONS,
    ROOF_SLOPE_DEGREES,
    PURLIN_LINES_PER_SLOPE
}
