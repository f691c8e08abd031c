package org.dxworks.blockgrid.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of the flattened program. Nesting is expressed through
 * {@link #parentLineId}; {@link #indentLevel} is presentation only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "kind", "indentLevel", "parentLineId", "slots"})
public class Line {
    public String id;
    public LineKind kind = LineKind.EXPRESSION;
    public int indentLevel;
    public String parentLineId; // nullable
    public List<Token> slots = new ArrayList<>(); // null entries are empty slots

    public Line() {
    }

    public Line(String id, LineKind kind, int indentLevel, String parentLineId, List<Token> slots) {
        this.id = id;
        this.kind = kind;
        this.indentLevel = indentLevel;
        this.parentLineId = parentLineId;
        this.slots = new ArrayList<>(slots);
    }

    /**
     * Tokens placed in this line, in slot order, without the empty slots.
     */
    public List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        if (slots == null) {
            return tokens;
        }
        for (Token token : slots) {
            if (token != null) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public Optional<Token> firstToken() {
        List<Token> tokens = tokens();
        return tokens.isEmpty() ? Optional.empty() : Optional.of(tokens.get(0));
    }

    public boolean isControlLine(ControlKeyword keyword) {
        return firstToken().map(token -> token.isControl(keyword)).orElse(false);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tokens().isEmpty();
    }

    public boolean hasParent(String lineId) {
        return Objects.equals(parentLineId, lineId);
    }
}
