package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"width", "height"})
public final class GridSize {
    public final int width;
    public final int height;

    public GridSize(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid dimensions must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public static GridSize of(int width, int height) {
        return new GridSize(width, height);
    }

    public int cellCount() {
        return width * height;
    }

    /**
     * A {@code height x width} matrix with every cell set to {@code color}.
     */
    public List<List<String>> fill(String color) {
        List<List<String>> grid = new ArrayList<>(height);
        for (int y = 0; y < height; y++) {
            grid.add(Collections.unmodifiableList(new ArrayList<>(Collections.nCopies(width, color))));
        }
        return Collections.unmodifiableList(grid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridSize other)) return false;
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
