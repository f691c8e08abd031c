package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the orchestrator hands to the rendering side: the grid is always
 * fully populated, {@code parseErrors} is null unless parsing failed.
 */
@JsonPropertyOrder({"success", "grid", "parseErrors", "runtimeErrors"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunResult {
    public final boolean success;
    public final List<List<String>> grid;
    public final List<ParseError> parseErrors;
    public final List<RuntimeError> runtimeErrors;

    private RunResult(boolean success, List<List<String>> grid,
                      List<ParseError> parseErrors, List<RuntimeError> runtimeErrors) {
        this.success = success;
        this.grid = grid;
        this.parseErrors = parseErrors == null ? null : Collections.unmodifiableList(new ArrayList<>(parseErrors));
        this.runtimeErrors = Collections.unmodifiableList(new ArrayList<>(runtimeErrors));
    }

    public static RunResult parseFailure(List<List<String>> defaultGrid, List<ParseError> parseErrors) {
        return new RunResult(false, defaultGrid, parseErrors, List.of());
    }

    public static RunResult evaluated(EvaluationResult evaluation) {
        return new RunResult(evaluation.success, evaluation.grid, null, evaluation.errors);
    }

    public boolean hasParseErrors() {
        return parseErrors != null && !parseErrors.isEmpty();
    }
}
