package com.structural.topology.model;

import lombok.Builder;
import lombok.Value;

/**
 * Dimensional and typological input of one generation call.
 *
 * Carries every parameter any topology kind may use. Kind-specific values are boxed
 * and stay {@code null} when not supplied; each topology variant decides which of
 * them it requires.
 */
@Value
@Builder(toBuilder = true)
public class TopologyParameters {

    // ---- Trusses ----

    /**
     * Overall truss span.
     */
    Double span;

    /**
     * Truss depth at full height (peak height for a bowstring arch).
     */
    Double height;

    /**
     * Number of panels along the span.
     */
    Integer panelCount;

    // ---- Frames ----

    /**
     * Declared building length. Used to derive the bay count when none is given.
     */
    Double length;

    /**
     * Distance between the two column lines of a frame.
     */
    Double width;

    Double eaveHeight;

    Double ridgeHeight;

    Integer numBays;

    Double baySpacing;

    boolean includePurlins;

    Double purlinSpacing;

    boolean includeBracing;

    // ---- Building grids ----

    Integer baysX;

    Integer baysZ;

    Double bayWidth;

    Double bayDepth;

    Integer stories;

    Double storyHeight;

    // ---- Plate meshes ----

    Double wallHeight;

    Double wallWidth;

    Double wallThickness;

    Double slabLength;

    Double slabWidth;

    Double slabThickness;
}
