package org.dxworks.blockgrid.model.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Common root of the executable tree built from a structure.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = VariableRef.class, name = "Variable"),
        @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
        @JsonSubTypes.Type(value = BinaryOp.class, name = "BinaryOperation"),
        @JsonSubTypes.Type(value = Conditional.class, name = "Conditional"),
        @JsonSubTypes.Type(value = Program.class, name = "Program")
})
public interface SyntaxNode {

    <R> R accept(NodeVisitor<R> visitor);
}
