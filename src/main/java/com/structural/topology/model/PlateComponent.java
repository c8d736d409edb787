package com.structural.topology.model;

/**
 * Component of a plate mesh model.
 */
public enum PlateComponent {
    /**
     * Vertical wall mesh.
     */
    WALL,

    /**
     * Horizontal base slab mesh.
     */
    SLAB
}
