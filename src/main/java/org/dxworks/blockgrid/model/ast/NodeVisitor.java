package org.dxworks.blockgrid.model.ast;

public interface NodeVisitor<R> {

    R visitLiteral(Literal literal);

    R visitVariableRef(VariableRef variable);

    R visitAssignment(Assignment assignment);

    R visitBinaryOp(BinaryOp operation);

    R visitConditional(Conditional conditional);

    R visitProgram(Program program);
}
