package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

@JsonPropertyOrder({"variable", "value", "line"})
@JsonTypeName("Assignment")
public final class Assignment extends Statement {
    public final VariableRef variable;
    public final Expression value;

    public Assignment(VariableRef variable, Expression value, Integer line) {
        super(line);
        this.variable = Objects.requireNonNull(variable, "variable");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Assignment(String variable, Expression value) {
        this(new VariableRef(variable), value, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String toString() {
        return variable + " = " + value;
    }
}
