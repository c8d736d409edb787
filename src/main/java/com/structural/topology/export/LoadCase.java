package com.structural.topology.export;

/**
 * Primary load cases, written in declaration order and numbered from 1. A case with no
 * load lines is left out and does not take a number.
 */
public enum LoadCase {
    DEAD("Dead", "DEAD LOAD"),
    LIVE("Live", "LIVE LOAD"),
    WIND("Wind", "WIND LOAD");

    private final String loadType;
    private final String title;

    LoadCase(String loadType, String title) {
        this.loadType = loadType;
        this.title = title;
    }

    public String getLoadType() {
        return loadType;
    }

    public String getTitle() {
        return title;
    }
}
