package org.dxworks.blockgrid.parser;

import org.dxworks.blockgrid.model.result.ErrorCategory;

/**
 * Raised while parsing a single line; caught by {@link StructureParser}
 * and turned into a {@link org.dxworks.blockgrid.model.result.ParseError}.
 */
public class LineParseException extends Exception {

    private final ErrorCategory category;

    public LineParseException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public static LineParseException syntax(String message) {
        return new LineParseException(message, ErrorCategory.SYNTAX);
    }

    public static LineParseException semantic(String message) {
        return new LineParseException(message, ErrorCategory.SEMANTIC);
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
