package org.dxworks.blockgrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind hint recorded by the editing surface. Advisory only: the parser
 * classifies a line by its tokens, never by this value.
 */
public enum LineKind {
    EXPRESSION("expression"),
    CONDITION("condition"),
    ASSIGNMENT("assignment");

    private final String name;

    LineKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static LineKind fromName(String name) {
        for (LineKind kind : values()) {
            if (kind.name.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown line kind: " + name);
    }
}
