package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

@JsonPropertyOrder({"name", "line"})
@JsonTypeName("Variable")
public final class VariableRef extends Expression {
    public final String name;

    public VariableRef(String name, Integer line) {
        super(line);
        this.name = Objects.requireNonNull(name, "name");
    }

    public VariableRef(String name) {
        this(name, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariableRef(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
