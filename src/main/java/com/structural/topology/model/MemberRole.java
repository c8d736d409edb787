package com.structural.topology.model;

/**
 * Structural classification of a member, used downstream to pick sections and loads.
 */
public enum MemberRole {
    CHORD_TOP("chord-top"),
    CHORD_BOTTOM("chord-bottom"),
    DIAGONAL("diagonal"),
    VERTICAL("vertical"),
    COLUMN("column"),
    RAFTER("rafter"),
    PURLIN("purlin"),
    BRACING("bracing"),
    BEAM("beam"),
    PLATE_EDGE("plate-edge");

    private final String label;

    MemberRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
