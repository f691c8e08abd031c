package org.dxworks.blockgrid.parser;

import org.dxworks.blockgrid.model.Line;
import org.dxworks.blockgrid.model.Structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only arena over a structure's lines: position lookup by id and
 * children lookup by parent id. Dangling parent ids simply have no owner.
 */
final class StructureIndex {

    private final List<Line> lines;
    private final Map<String, Integer> indexById = new HashMap<>();
    private final Map<String, List<Integer>> childrenByParent = new HashMap<>();

    StructureIndex(Structure structure) {
        List<Line> source = structure == null || structure.lines == null ? List.of() : structure.lines;
        this.lines = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            Line line = source.get(i) == null ? new Line() : source.get(i);
            lines.add(line);
            if (line.id != null) {
                // first occurrence owns a duplicated id
                indexById.putIfAbsent(line.id, i);
            }
            if (line.parentLineId != null) {
                childrenByParent.computeIfAbsent(line.parentLineId, k -> new ArrayList<>()).add(i);
            }
        }
    }

    int size() {
        return lines.size();
    }

    Line get(int index) {
        return lines.get(index);
    }

    /**
     * Indexes of the lines whose parent is the line at {@code index}, in sequence order.
     * Empty when the line has no id or is a later duplicate of another line's id.
     */
    List<Integer> childrenOf(int index) {
        Line line = lines.get(index);
        if (line.id == null || indexById.get(line.id) != index) {
            return Collections.emptyList();
        }
        return childrenByParent.getOrDefault(line.id, Collections.emptyList());
    }
}
