package org.dxworks.blockgrid.parser;

import org.dxworks.blockgrid.model.ControlKeyword;
import org.dxworks.blockgrid.model.Line;
import org.dxworks.blockgrid.model.Operator;
import org.dxworks.blockgrid.model.Structure;
import org.dxworks.blockgrid.model.Token;
import org.dxworks.blockgrid.model.TokenKind;
import org.dxworks.blockgrid.model.ast.Assignment;
import org.dxworks.blockgrid.model.ast.BinaryOp;
import org.dxworks.blockgrid.model.ast.Conditional;
import org.dxworks.blockgrid.model.ast.DataType;
import org.dxworks.blockgrid.model.ast.Expression;
import org.dxworks.blockgrid.model.ast.Literal;
import org.dxworks.blockgrid.model.ast.Program;
import org.dxworks.blockgrid.model.ast.Statement;
import org.dxworks.blockgrid.model.ast.VariableRef;
import org.dxworks.blockgrid.model.result.ParseError;
import org.dxworks.blockgrid.model.result.ParseResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a {@link Program} from the flattened line list.
 *
 * - Every top-level line is attempted; errors are collected, never fail-fast.
 * - {@code if} lines pull in the lines that name them as parent (then body) and the
 *   next {@code else} line sharing their parent (else body).
 * - Each line is consumed at most once, so dangling or cyclic parent ids cannot loop.
 *
 * Stateless; a single instance can be shared between threads.
 */
public class StructureParser {

    static final String NESTED_ERROR_PREFIX = "Error in nested statement: ";

    public ParseResult parse(Structure structure) {
        StructureIndex index = new StructureIndex(structure);
        boolean[] consumed = new boolean[index.size()];
        List<Statement> statements = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();

        for (int i = 0; i < index.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            try {
                Statement statement = parseWithChildren(index, i, consumed);
                if (statement != null) {
                    statements.add(statement);
                }
            } catch (LineParseException e) {
                errors.add(new ParseError(i, e.getMessage(), e.getCategory()));
            }
        }

        return ParseResult.of(new Program(statements), errors);
    }

    private Statement parseWithChildren(StructureIndex index, int lineIndex, boolean[] consumed)
            throws LineParseException {
        consumed[lineIndex] = true;
        Line line = index.get(lineIndex);
        List<Token> tokens = line.tokens();

        if (tokens.isEmpty() || line.isControlLine(ControlKeyword.ELSE)) {
            // a stray else without a preceding if is tolerated
            return null;
        }

        if (tokens.get(0).isControl(ControlKeyword.IF)) {
            BinaryOp condition = parseCondition(tokens, lineIndex);
            List<Statement> thenBody = parseBody(index, lineIndex, consumed);

            List<Statement> elseBody = null;
            int elseIndex = findElseLine(index, lineIndex, consumed);
            if (elseIndex >= 0) {
                consumed[elseIndex] = true;
                elseBody = parseBody(index, elseIndex, consumed);
            }
            return new Conditional(condition, thenBody, elseBody, lineIndex);
        }

        if (looksLikeAssignment(tokens)) {
            return parseAssignment(tokens, lineIndex);
        }

        throw LineParseException.syntax("Unrecognized code pattern at line " + (lineIndex + 1));
    }

    /**
     * Parses the children of the line at {@code parentIndex}. The first failing child
     * fails the whole enclosing statement as a syntax error; children after it are left
     * for the top-level loop.
     */
    private List<Statement> parseBody(StructureIndex index, int parentIndex, boolean[] consumed)
            throws LineParseException {
        List<Statement> body = new ArrayList<>();
        for (int childIndex : index.childrenOf(parentIndex)) {
            if (consumed[childIndex] || index.get(childIndex).isControlLine(ControlKeyword.ELSE)) {
                continue;
            }
            try {
                Statement statement = parseWithChildren(index, childIndex, consumed);
                if (statement != null) {
                    body.add(statement);
                }
            } catch (LineParseException e) {
                throw LineParseException.syntax(NESTED_ERROR_PREFIX + e.getMessage());
            }
        }
        return body;
    }

    /**
     * First later line with the same parent that starts with {@code else}.
     * Another {@code if} with the same parent ends the search.
     */
    private int findElseLine(StructureIndex index, int ifIndex, boolean[] consumed) {
        Line ifLine = index.get(ifIndex);
        for (int i = ifIndex + 1; i < index.size(); i++) {
            Line candidate = index.get(i);
            if (consumed[i] || !candidate.hasParent(ifLine.parentLineId)) {
                continue;
            }
            if (candidate.isControlLine(ControlKeyword.ELSE)) {
                return i;
            }
            if (candidate.isControlLine(ControlKeyword.IF)) {
                break;
            }
        }
        return -1;
    }

    private BinaryOp parseCondition(List<Token> tokens, int lineIndex) throws LineParseException {
        if (tokens.size() < 4) {
            throw LineParseException.syntax("Invalid if condition: expected format \"if variable operator value\"");
        }

        Expression left = parseValue(tokens.get(1), lineIndex);

        Token operatorToken = tokens.get(2);
        if (operatorToken.kind != TokenKind.OPERATOR) {
            throw LineParseException.syntax("Invalid condition: expected comparison operator");
        }
        Operator operator = operatorToken.operator()
                .filter(Operator::isComparison)
                .orElseThrow(() -> LineParseException.syntax(
                        "Invalid condition: unsupported comparison operator " + operatorToken.value));

        Expression right = parseValue(tokens.get(3), lineIndex);
        return new BinaryOp(operator, left, right, lineIndex);
    }

    private boolean looksLikeAssignment(List<Token> tokens) {
        if (tokens.get(0).isVariable()) {
            return true;
        }
        for (Token token : tokens) {
            if (token.isOperator(Operator.ASSIGN)) {
                return true;
            }
        }
        return false;
    }

    private Assignment parseAssignment(List<Token> tokens, int lineIndex) throws LineParseException {
        Token target = tokens.get(0);
        if (!target.isVariable()) {
            throw LineParseException.semantic("Invalid assignment target: expected variable, got " + target.kind);
        }
        if (tokens.size() < 2 || !tokens.get(1).isOperator(Operator.ASSIGN)) {
            throw LineParseException.syntax("Invalid assignment: expected = operator");
        }
        if (tokens.size() < 3) {
            throw LineParseException.syntax("Invalid assignment: missing value");
        }
        if (tokens.size() > 3) {
            throw LineParseException.syntax("Invalid assignment: unexpected token after value");
        }

        VariableRef variable = new VariableRef(target.value, lineIndex);
        Expression value = parseValue(tokens.get(2), lineIndex);
        return new Assignment(variable, value, lineIndex);
    }

    private Expression parseValue(Token token, int lineIndex) throws LineParseException {
        return switch (token.kind) {
            case VARIABLE -> new VariableRef(token.value, lineIndex);
            case COLOR -> new Literal(token.value, DataType.COLOR, lineIndex);
            case NUMBER -> new Literal(parseNumber(token), DataType.NUMBER, lineIndex);
            default -> throw LineParseException.syntax("Unsupported value type: " + token.kind);
        };
    }

    private int parseNumber(Token token) throws LineParseException {
        try {
            return Integer.parseInt(token.value.trim(), 10);
        } catch (NumberFormatException e) {
            throw LineParseException.syntax("Invalid number: " + token.value);
        }
    }
}
