package org.dxworks.blockgrid;

import org.dxworks.blockgrid.model.Structure;
import org.dxworks.blockgrid.model.StructureBuilder;
import org.dxworks.blockgrid.model.Token;
import org.dxworks.blockgrid.model.result.ErrorCategory;
import org.dxworks.blockgrid.model.result.GridSize;
import org.dxworks.blockgrid.model.result.RunResult;
import org.dxworks.blockgrid.model.result.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

import static org.dxworks.blockgrid.TestUtils.structure;
import static org.junit.jupiter.api.Assertions.*;

public class EvaluationServiceTest {

    private final EvaluationService service = new EvaluationService();

    @Test
    void emptyStructureGivesUnsetGrid() {
        RunResult result = service.run(new Structure(), GridSize.of(2, 2));

        assertTrue(result.success);
        assertNull(result.parseErrors);
        assertEquals(GridSize.of(2, 2).fill(""), result.grid);
        assertTrue(result.runtimeErrors.isEmpty());
    }

    @Test
    void singleAssignmentColorsEveryCell() {
        RunResult result = service.run(structure()
                .line("l0", "var-p", "op-assign", "color-red")
                .build(), GridSize.of(2, 2));

        assertTrue(result.success);
        assertEquals(List.of(List.of("red", "red"), List.of("red", "red")), result.grid);
        assertTrue(result.runtimeErrors.isEmpty());
    }

    @Test
    void lastAssignmentWins() {
        RunResult result = service.run(structure()
                .line("l0", "var-p", "op-assign", "color-red")
                .line("l1", "var-p", "op-assign", "color-blue")
                .build(), GridSize.of(3, 2));

        assertEquals(GridSize.of(3, 2).fill("blue"), result.grid);
    }

    @Test
    void variableChainingMatchesDirectAssignment() {
        Structure chained = structure()
                .add(StructureBuilder.rawLine("l0", null, Token.variable("a"), Token.operator("="), Token.color("red")))
                .add(StructureBuilder.rawLine("l1", null, Token.variable("b"), Token.operator("="), Token.variable("a")))
                .add(StructureBuilder.rawLine("l2", null, Token.variable("p"), Token.operator("="), Token.variable("b")))
                .build();
        Structure direct = structure()
                .line("l0", "var-p", "op-assign", "color-red")
                .build();

        for (GridSize size : List.of(GridSize.of(1, 1), GridSize.of(3, 2), GridSize.of(5, 5))) {
            assertEquals(service.run(direct, size).grid, service.run(chained, size).grid);
        }
    }

    @Test
    void ifElseColorsTheMatchingColumn() {
        RunResult result = service.run(ifElse("op-equals", "num-2"), GridSize.of(5, 1));

        assertTrue(result.success);
        assertEquals(List.of(List.of("blue", "blue", "red", "blue", "blue")), result.grid);
    }

    @Test
    void exactlyOneBranchRunsForEveryCell() {
        RunResult result = service.run(ifElse("op-less", "num-3"), GridSize.of(5, 5));

        for (List<String> row : result.grid) {
            for (String cell : row) {
                assertTrue(cell.equals("red") || cell.equals("blue"), cell);
            }
        }
    }

    @Test
    void everyComparisonOperatorMatchesIntegerComparison() {
        Map<String, BiPredicate<Integer, Integer>> operators = Map.of(
                "op-equals", (a, b) -> a.intValue() == b.intValue(),
                "op-not-equals", (a, b) -> a.intValue() != b.intValue(),
                "op-less", (a, b) -> a < b,
                "op-greater", (a, b) -> a > b,
                "op-less-equal", (a, b) -> a <= b,
                "op-greater-equal", (a, b) -> a >= b
        );
        int width = 6;

        for (Map.Entry<String, BiPredicate<Integer, Integer>> entry : operators.entrySet()) {
            for (int k = 0; k <= 4; k++) {
                RunResult result = service.run(ifElse(entry.getKey(), "num-" + k), GridSize.of(width, 1));
                assertTrue(result.success);
                for (int x = 0; x < width; x++) {
                    String expected = entry.getValue().test(x, k) ? "red" : "blue";
                    assertEquals(expected, result.grid.get(0).get(x), entry.getKey() + " " + k + " at x=" + x);
                }
            }
        }
    }

    @Test
    void undefinedVariableFailsEveryCell() {
        Structure structure = structure()
                .add(StructureBuilder.rawLine("l0", null, Token.variable("p"), Token.operator("="), Token.variable("undefinedVar")))
                .build();

        RunResult result = service.run(structure, GridSize.of(3, 2));

        assertFalse(result.success);
        assertNull(result.parseErrors);
        assertEquals(6, result.runtimeErrors.size());
        assertEquals(GridSize.of(3, 2).fill(""), result.grid);
        assertEquals("Undefined variable: undefinedVar", result.runtimeErrors.get(0).message);
    }

    @Test
    void parseFailureSkipsEvaluationAndReturnsDefaultGrid() {
        RunResult result = service.run(structure()
                .line("l0", "num-2", "op-assign", "color-red")
                .line("l1", "var-p", "op-assign", "color-blue")
                .build(), GridSize.of(2, 2));

        assertFalse(result.success);
        assertEquals(GridSize.of(2, 2).fill("gray"), result.grid);
        assertEquals(1, result.parseErrors.size());
        assertEquals(ErrorCategory.SEMANTIC, result.parseErrors.get(0).category);
        assertTrue(result.runtimeErrors.isEmpty());
    }

    @Test
    void parseFailureColorComesFromConfig() {
        EvaluationService custom = new EvaluationService(BlockgridConfig.with(5, 5, "", "", "black", false));
        RunResult result = custom.run(structure().line("l0", "color-red").build(), GridSize.of(1, 1));

        assertEquals(List.of(List.of("black")), result.grid);
    }

    @Test
    void rerunningIsDeterministic() {
        Structure structure = structure()
                .line("if", "ctrl-if", "var-y", "op-greater", "num-1")
                .child("then", "if", "var-p", "op-assign", "var-q")
                .line("else", "ctrl-else")
                .child("else-body", "else", "var-p", "op-assign", "color-green")
                .build();

        RunResult first = service.run(structure, GridSize.of(4, 4));
        RunResult second = service.run(structure, GridSize.of(4, 4));

        assertEquals(first.grid, second.grid);
        assertEquals(first.runtimeErrors, second.runtimeErrors);
        assertEquals(8, first.runtimeErrors.size());
    }

    @Test
    void validateReportsParseErrorsOnly() {
        ValidationResult valid = service.validate(structure()
                .add(StructureBuilder.rawLine("l0", null, Token.variable("p"), Token.operator("="), Token.variable("nowhere")))
                .build());
        assertTrue(valid.valid);

        ValidationResult invalid = service.validate(structure()
                .line("l0", "ctrl-if", "var-x")
                .line("l1", "op-assign")
                .build());
        assertFalse(invalid.valid);
        assertEquals(2, invalid.errors.size());
    }

    private static Structure ifElse(String operatorId, String numberId) {
        return structure()
                .line("line-if", "ctrl-if", "var-x", operatorId, numberId)
                .child("line-then", "line-if", "var-p", "op-assign", "color-red")
                .line("line-else", "ctrl-else")
                .child("line-else-body", "line-else", "var-p", "op-assign", "color-blue")
                .build();
    }
}
