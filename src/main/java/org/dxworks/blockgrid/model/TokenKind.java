package org.dxworks.blockgrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TokenKind {
    VARIABLE("variable"),
    NUMBER("number"),
    OPERATOR("operator"),
    COLOR("color"),
    CONTROL("control");

    private final String name;

    TokenKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static TokenKind fromName(String name) {
        for (TokenKind kind : values()) {
            if (kind.name.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown token kind: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
