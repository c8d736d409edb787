package com.structural.topology.export;

public enum SupportType {
    PINNED("PINNED"),
    FIXED("FIXED");

    private final String keyword;

    SupportType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
