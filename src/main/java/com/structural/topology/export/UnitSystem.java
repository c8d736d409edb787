package com.structural.topology.export;

/**
 * Length and force units declared in the exported model header.
 */
public enum UnitSystem {
    FEET_KIP("FEET KIP"),
    METER_KN("METER KN"),
    INCHES_KIP("INCHES KIP");

    private final String keyword;

    UnitSystem(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
