package com.structural.topology.model;

/**
 * Named joint sets downstream consumers need for boundary conditions and loads.
 */
public enum Landmark {
    BOTTOM_CHORD,
    TOP_CHORD,
    SUPPORT_CANDIDATES,
    BASE_JOINTS,
    EAVE_JOINTS,
    RIDGE_JOINTS,
    /**
     * Interior bottom chord joints that carry deck load.
     */
    LOADED_JOINTS,
    WALL_JOINTS,
    SLAB_JOINTS
}
