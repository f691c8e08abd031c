package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A defect on one line of the structure. {@code line} is the 0-based index of
 * the offending line in the structure's line sequence.
 */
@JsonPropertyOrder({"line", "message", "category"})
public final class ParseError {
    public final int line;
    public final String message;
    public final ErrorCategory category;

    public ParseError(int line, String message, ErrorCategory category) {
        this.line = line;
        this.message = message;
        this.category = category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError other)) return false;
        return line == other.line && Objects.equals(message, other.message) && category == other.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, message, category);
    }

    @Override
    public String toString() {
        return "line " + line + " (" + category.getName() + "): " + message;
    }
}
