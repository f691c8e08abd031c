package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class Statement implements SyntaxNode {
    public final Integer line; // source line index, null for hand-built nodes

    protected Statement(Integer line) {
        this.line = line;
    }
}
