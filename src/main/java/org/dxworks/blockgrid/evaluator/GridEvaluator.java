package org.dxworks.blockgrid.evaluator;

import org.dxworks.blockgrid.model.ast.Assignment;
import org.dxworks.blockgrid.model.ast.BinaryOp;
import org.dxworks.blockgrid.model.ast.Conditional;
import org.dxworks.blockgrid.model.ast.Literal;
import org.dxworks.blockgrid.model.ast.NodeVisitor;
import org.dxworks.blockgrid.model.ast.Program;
import org.dxworks.blockgrid.model.ast.Statement;
import org.dxworks.blockgrid.model.ast.VariableRef;
import org.dxworks.blockgrid.model.result.EvaluationResult;
import org.dxworks.blockgrid.model.result.GridSize;
import org.dxworks.blockgrid.model.result.RuntimeError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Runs a {@link Program} once per grid cell and collects the final pixel colors.
 *
 * Each cell starts from a fresh {@link ExecutionScope} holding {@code x}, {@code y}
 * and an unset {@code p}. A cell that fails gets the error color and an entry in the
 * error list; the other cells are unaffected. Rows can be evaluated in parallel;
 * grid contents and error order are the same either way.
 */
public class GridEvaluator {

    private final String unsetColor;
    private final String errorColor;
    private final boolean parallel;

    public GridEvaluator() {
        this(ExecutionScope.UNSET_PIXEL, ExecutionScope.UNSET_PIXEL, false);
    }

    public GridEvaluator(String unsetColor, String errorColor, boolean parallel) {
        this.unsetColor = Objects.requireNonNull(unsetColor, "unsetColor");
        this.errorColor = Objects.requireNonNull(errorColor, "errorColor");
        this.parallel = parallel;
    }

    public EvaluationResult evaluate(Program program, GridSize size) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(size, "size");

        String[][] cells = new String[size.height][size.width];
        List<List<RuntimeError>> errorsByRow = new ArrayList<>(Collections.nCopies(size.height, null));

        IntStream rows = IntStream.range(0, size.height);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(y -> errorsByRow.set(y, evaluateRow(program, y, cells[y])));

        List<List<String>> grid = new ArrayList<>(size.height);
        List<RuntimeError> errors = new ArrayList<>();
        for (int y = 0; y < size.height; y++) {
            grid.add(Collections.unmodifiableList(Arrays.asList(cells[y])));
            errors.addAll(errorsByRow.get(y));
        }
        return new EvaluationResult(Collections.unmodifiableList(grid), errors);
    }

    private List<RuntimeError> evaluateRow(Program program, int y, String[] row) {
        List<RuntimeError> errors = new ArrayList<>();
        for (int x = 0; x < row.length; x++) {
            try {
                ExecutionScope scope = ExecutionScope.forCell(x, y);
                new CellExecution(scope).executeAll(program.body);
                row[x] = colorOf(scope.pixel());
            } catch (EvaluationException e) {
                errors.add(new RuntimeError(x, y, e.getMessage()));
                row[x] = errorColor;
            }
        }
        return errors;
    }

    private String colorOf(Object pixel) {
        return Values.isTruthy(pixel) ? String.valueOf(pixel) : unsetColor;
    }

    /**
     * Statement and expression execution for one cell. Statements yield null.
     */
    private static final class CellExecution implements NodeVisitor<Object> {
        private final ExecutionScope scope;

        CellExecution(ExecutionScope scope) {
            this.scope = scope;
        }

        void executeAll(List<Statement> statements) {
            for (Statement statement : statements) {
                statement.accept(this);
            }
        }

        @Override
        public Object visitAssignment(Assignment assignment) {
            scope.assign(assignment.variable.name, assignment.value.accept(this));
            return null;
        }

        @Override
        public Object visitConditional(Conditional conditional) {
            if (Values.isTruthy(conditional.condition.accept(this))) {
                executeAll(conditional.thenBody);
            } else if (conditional.hasElse()) {
                executeAll(conditional.elseBody);
            }
            return null;
        }

        @Override
        public Object visitLiteral(Literal literal) {
            return literal.value;
        }

        @Override
        public Object visitVariableRef(VariableRef variable) {
            return scope.lookup(variable.name);
        }

        @Override
        public Object visitBinaryOp(BinaryOp operation) {
            // both sides are always evaluated, no short-circuit
            Object left = operation.left.accept(this);
            Object right = operation.right.accept(this);
            return Values.apply(operation.operator, left, right);
        }

        @Override
        public Object visitProgram(Program program) {
            executeAll(program.body);
            return null;
        }
    }
}
