package org.dxworks.blockgrid.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.blockgrid.model.ast.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of parsing a structure. The program is only present when no
 * line failed; a partially parsed program is never handed out.
 */
@JsonPropertyOrder({"success", "program", "errors"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParseResult {
    public final boolean success;
    public final Program program; // null unless success
    public final List<ParseError> errors;

    private ParseResult(Program program, List<ParseError> errors) {
        this.success = errors.isEmpty();
        this.program = success ? program : null;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ParseResult of(Program program, List<ParseError> errors) {
        return new ParseResult(program, errors);
    }
}
