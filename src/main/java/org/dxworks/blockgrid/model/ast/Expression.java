package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class Expression implements SyntaxNode {
    public final Integer line; // source line index, null for hand-built nodes

    protected Expression(Integer line) {
        this.line = line;
    }
}
