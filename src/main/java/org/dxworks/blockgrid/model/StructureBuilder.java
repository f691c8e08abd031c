package org.dxworks.blockgrid.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Assembles {@link Structure} values from catalog ids, the way the editor
 * would after a user dropped tokens into slots. A {@code null} id leaves
 * the slot empty.
 *
 * <pre>
 * Structure s = StructureBuilder.using(TokenCatalog.standard())
 *         .line("line-if", "ctrl-if", "var-x", "op-equals", "num-2")
 *         .child("line-then", "line-if", "var-p", "op-assign", "color-red")
 *         .build();
 * </pre>
 */
public class StructureBuilder {

    private final TokenCatalog catalog;
    private final List<Line> lines = new ArrayList<>();
    private String structureId;

    private StructureBuilder(TokenCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public static StructureBuilder using(TokenCatalog catalog) {
        return new StructureBuilder(catalog);
    }

    public StructureBuilder id(String id) {
        this.structureId = id;
        return this;
    }

    /**
     * Top-level line (no parent, indent 0).
     */
    public StructureBuilder line(String lineId, String... tokenIds) {
        return add(lineId, null, 0, tokenIds);
    }

    /**
     * Line nested under {@code parentLineId}, indented one level deeper than its parent.
     */
    public StructureBuilder child(String lineId, String parentLineId, String... tokenIds) {
        return add(lineId, parentLineId, indentOf(parentLineId) + 1, tokenIds);
    }

    /**
     * Line with an explicit parent and indent. The parent does not have to exist.
     */
    public StructureBuilder add(String lineId, String parentLineId, int indentLevel, String... tokenIds) {
        List<Token> slots = new ArrayList<>();
        if (tokenIds == null) {
            tokenIds = new String[]{null};
        }
        for (String tokenId : tokenIds) {
            slots.add(tokenId == null ? null : catalog.place(tokenId));
        }
        lines.add(new Line(lineId, guessKind(slots), indentLevel, parentLineId, slots));
        return this;
    }

    /**
     * Appends a line built elsewhere, for tokens the catalog does not offer.
     */
    public StructureBuilder add(Line line) {
        lines.add(Objects.requireNonNull(line, "line"));
        return this;
    }

    public Structure build() {
        return new Structure(structureId, lines);
    }

    public static Line rawLine(String lineId, String parentLineId, Token... slots) {
        List<Token> tokens = Arrays.asList(slots);
        return new Line(lineId, guessKind(tokens), 0, parentLineId, tokens);
    }

    private int indentOf(String lineId) {
        for (Line line : lines) {
            if (line.id != null && line.id.equals(lineId)) {
                return line.indentLevel;
            }
        }
        return 0;
    }

    private static LineKind guessKind(List<Token> slots) {
        for (Token token : slots) {
            if (token == null) continue;
            if (token.isControl(ControlKeyword.IF) || token.isControl(ControlKeyword.ELSE)) {
                return LineKind.CONDITION;
            }
            if (token.isOperator(Operator.ASSIGN)) {
                return LineKind.ASSIGNMENT;
            }
        }
        return LineKind.EXPRESSION;
    }
}
