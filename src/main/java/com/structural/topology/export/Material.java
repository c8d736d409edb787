package com.structural.topology.export;

/**
 * Material assigned to every member and element of the exported model.
 */
public enum Material {
    STEEL("STEEL"),
    CONCRETE("CONCRETE");

    private final String keyword;

    Material(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
