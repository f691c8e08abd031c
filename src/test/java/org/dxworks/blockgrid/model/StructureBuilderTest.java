package org.dxworks.blockgrid.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StructureBuilderTest {

    @Test
    void buildsNestedLinesWithIndentAndKinds() {
        Structure structure = StructureBuilder.using(TokenCatalog.standard())
                .id("demo")
                .line("line-if", "ctrl-if", "var-x", "op-equals", "num-2")
                .child("line-then", "line-if", "var-p", "op-assign", "color-red")
                .line("line-else", "ctrl-else")
                .child("line-else-body", "line-else", "var-p", "op-assign", null)
                .build();

        assertEquals("demo", structure.id);
        assertEquals(4, structure.lines.size());

        Line ifLine = structure.lines.get(0);
        assertEquals(LineKind.CONDITION, ifLine.kind);
        assertNull(ifLine.parentLineId);
        assertEquals(0, ifLine.indentLevel);

        Line thenLine = structure.lines.get(1);
        assertEquals(LineKind.ASSIGNMENT, thenLine.kind);
        assertEquals("line-if", thenLine.parentLineId);
        assertEquals(1, thenLine.indentLevel);

        Line elseBody = structure.lines.get(3);
        assertEquals(3, elseBody.slots.size());
        assertNull(elseBody.slots.get(2));
        assertEquals(2, elseBody.tokens().size());
    }

    @Test
    void lineHelpersIgnoreEmptySlots() {
        Line line = StructureBuilder.rawLine("l", null, null, Token.control("else"), null);
        assertEquals(1, line.tokens().size());
        assertTrue(line.isControlLine(ControlKeyword.ELSE));
        assertFalse(line.isEmpty());

        Line empty = StructureBuilder.rawLine("e", null, null, null);
        assertTrue(empty.isEmpty());
        assertTrue(empty.firstToken().isEmpty());
    }
}
