package com.structural.topology.model;

/**
 * Groups topology kinds that share connectivity guarantees.
 */
public enum TopologyFamily {
    TRUSS,
    FRAME,
    GRID,
    PLATE
}
