package org.dxworks.blockgrid;

import org.dxworks.blockgrid.evaluator.GridEvaluator;
import org.dxworks.blockgrid.model.Structure;
import org.dxworks.blockgrid.model.result.EvaluationResult;
import org.dxworks.blockgrid.model.result.GridSize;
import org.dxworks.blockgrid.model.result.ParseResult;
import org.dxworks.blockgrid.model.result.RunResult;
import org.dxworks.blockgrid.model.result.ValidationResult;
import org.dxworks.blockgrid.parser.StructureParser;

import java.util.Objects;

/**
 * Parses a structure and, only if that succeeds, evaluates it over the grid.
 * A failed parse short-circuits to a grid filled with the parse failure color.
 */
public class EvaluationService {

    private final StructureParser parser;
    private final GridEvaluator evaluator;
    private final String parseFailureColor;

    public EvaluationService() {
        this(BlockgridConfig.defaults());
    }

    public EvaluationService(BlockgridConfig config) {
        this(new StructureParser(),
                new GridEvaluator(config.getUnsetColor(), config.getErrorColor(), config.isParallelEvaluation()),
                config.getParseFailureColor());
    }

    public EvaluationService(StructureParser parser, GridEvaluator evaluator, String parseFailureColor) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.parseFailureColor = Objects.requireNonNull(parseFailureColor, "parseFailureColor");
    }

    public RunResult run(Structure structure, GridSize gridSize) {
        Objects.requireNonNull(gridSize, "gridSize");

        ParseResult parseResult = parser.parse(structure);
        if (!parseResult.success) {
            return RunResult.parseFailure(gridSize.fill(parseFailureColor), parseResult.errors);
        }

        EvaluationResult evaluation = evaluator.evaluate(parseResult.program, gridSize);
        return RunResult.evaluated(evaluation);
    }

    /**
     * Parse-only check, for reporting defects without computing a grid.
     */
    public ValidationResult validate(Structure structure) {
        return new ValidationResult(parser.parse(structure).errors);
    }
}
