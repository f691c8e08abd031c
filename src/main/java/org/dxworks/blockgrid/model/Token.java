package org.dxworks.blockgrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.Optional;

/**
 * A typed unit of code placed into a line slot.
 * The instance id only identifies a placed copy for the editing surface;
 * it takes no part in equality, parsing or evaluation.
 */
@JsonPropertyOrder({"kind", "value", "instanceId"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Token {
    public final TokenKind kind;
    public final String value;
    public final String instanceId;

    @JsonCreator
    public Token(@JsonProperty("kind") TokenKind kind,
                 @JsonProperty("value") String value,
                 @JsonProperty("instanceId") String instanceId) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.instanceId = instanceId;
    }

    public Token(TokenKind kind, String value) {
        this(kind, value, null);
    }

    public static Token variable(String name) {
        return new Token(TokenKind.VARIABLE, name);
    }

    public static Token number(String digits) {
        return new Token(TokenKind.NUMBER, digits);
    }

    public static Token operator(String symbol) {
        return new Token(TokenKind.OPERATOR, symbol);
    }

    public static Token color(String color) {
        return new Token(TokenKind.COLOR, color);
    }

    public static Token control(String keyword) {
        return new Token(TokenKind.CONTROL, keyword);
    }

    public Token withInstanceId(String newInstanceId) {
        return new Token(kind, value, newInstanceId);
    }

    @JsonIgnore
    public boolean isVariable() {
        return kind == TokenKind.VARIABLE;
    }

    public boolean isControl(ControlKeyword keyword) {
        return kind == TokenKind.CONTROL && keyword.getKeyword().equals(value);
    }

    /**
     * Operator view of this token; empty for non-operator tokens and unknown symbols.
     */
    public Optional<Operator> operator() {
        if (kind != TokenKind.OPERATOR) {
            return Optional.empty();
        }
        return Operator.fromSymbol(value);
    }

    public boolean isOperator(Operator operator) {
        return operator().map(op -> op == operator).orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
