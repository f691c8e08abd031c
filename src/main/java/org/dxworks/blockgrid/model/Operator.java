package org.dxworks.blockgrid.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Operator {
    ASSIGN("=", false),
    EQUALS("==", true),
    NOT_EQUALS("!=", true),
    LESS("<", true),
    GREATER(">", true),
    LESS_EQUAL("<=", true),
    GREATER_EQUAL(">=", true),
    ADD("+", false),
    SUBTRACT("-", false),
    MULTIPLY("*", false),
    DIVIDE("/", false),
    MODULO("%", false);

    private final String symbol;
    private final boolean comparison;

    Operator(String symbol, boolean comparison) {
        this.symbol = symbol;
        this.comparison = comparison;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public boolean isComparison() {
        return comparison;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
