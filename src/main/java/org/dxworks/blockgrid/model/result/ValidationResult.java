package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"valid", "errors"})
public final class ValidationResult {
    public final boolean valid;
    public final List<ParseError> errors;

    public ValidationResult(List<ParseError> errors) {
        this.errors = List.copyOf(errors);
        this.valid = this.errors.isEmpty();
    }
}
