package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonPropertyOrder({"success", "grid", "errors"})
public final class EvaluationResult {
    public final boolean success;
    public final List<List<String>> grid;
    public final List<RuntimeError> errors;

    public EvaluationResult(List<List<String>> grid, List<RuntimeError> errors) {
        this.grid = grid;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.success = this.errors.isEmpty();
    }
}
