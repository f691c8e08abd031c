package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

@JsonPropertyOrder({"value", "dataType", "line"})
@JsonTypeName("Literal")
public final class Literal extends Expression {
    public final Object value;
    public final DataType dataType;

    public Literal(Object value, DataType dataType, Integer line) {
        super(line);
        this.value = Objects.requireNonNull(value, "value");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
    }

    public static Literal number(int value) {
        return new Literal(value, DataType.NUMBER, null);
    }

    public static Literal color(String color) {
        return new Literal(color, DataType.COLOR, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
