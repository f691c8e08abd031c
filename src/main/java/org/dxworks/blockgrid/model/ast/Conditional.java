package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code if condition then thenBody [else elseBody]}. The else body is null
 * when the source had no matching else line, and possibly empty otherwise.
 */
@JsonPropertyOrder({"condition", "thenBody", "elseBody", "line"})
@JsonTypeName("Conditional")
public final class Conditional extends Statement {
    public final Expression condition;
    public final List<Statement> thenBody;
    public final List<Statement> elseBody; // nullable

    public Conditional(Expression condition, List<Statement> thenBody, List<Statement> elseBody, Integer line) {
        super(line);
        if (!(condition instanceof BinaryOp) && !(condition instanceof VariableRef)) {
            throw new IllegalArgumentException("Condition must be a binary operation or a variable, got " + condition);
        }
        this.condition = condition;
        this.thenBody = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(thenBody, "thenBody")));
        this.elseBody = elseBody == null ? null : Collections.unmodifiableList(new ArrayList<>(elseBody));
    }

    public Conditional(Expression condition, List<Statement> thenBody, List<Statement> elseBody) {
        this(condition, thenBody, elseBody, null);
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
