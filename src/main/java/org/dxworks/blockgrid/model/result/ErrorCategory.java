package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCategory {
    SYNTAX("syntax"),
    SEMANTIC("semantic");

    private final String name;

    ErrorCategory(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
