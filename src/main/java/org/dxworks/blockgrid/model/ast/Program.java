package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@JsonTypeName("Program")
public final class Program implements SyntaxNode {
    public final List<Statement> body;

    public Program(List<Statement> body) {
        this.body = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(body, "body")));
    }

    public static Program empty() {
        return new Program(List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return body.isEmpty();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
