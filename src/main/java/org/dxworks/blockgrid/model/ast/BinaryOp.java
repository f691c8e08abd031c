package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.blockgrid.model.Operator;

import java.util.Objects;

@JsonPropertyOrder({"operator", "left", "right", "line"})
@JsonTypeName("BinaryOperation")
public final class BinaryOp extends Expression {
    public final Operator operator;
    public final Expression left;
    public final Expression right;

    public BinaryOp(Operator operator, Expression left, Expression right, Integer line) {
        super(line);
        this.operator = Objects.requireNonNull(operator, "operator");
        if (operator == Operator.ASSIGN) {
            throw new IllegalArgumentException("Assignment is a statement, not a binary operator");
        }
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOp(Operator operator, Expression left, Expression right) {
        this(operator, left, right, null);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return left + " " + operator + " " + right;
    }
}
