package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A failure while evaluating a single grid cell.
 */
@JsonPropertyOrder({"x", "y", "message"})
public final class RuntimeError {
    public final int x;
    public final int y;
    public final String message;

    public RuntimeError(int x, int y, String message) {
        this.x = x;
        this.y = y;
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuntimeError other)) return false;
        return x == other.x && y == other.y && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, message);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + "): " + message;
    }
}
