package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataType {
    NUMBER("number"),
    COLOR("color"),
    STRING("string");

    private final String name;

    DataType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
