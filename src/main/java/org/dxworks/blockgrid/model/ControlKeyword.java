package org.dxworks.blockgrid.model;

public enum ControlKeyword {
    IF("if"),
    ELSE("else");

    private final String keyword;

    ControlKeyword(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
