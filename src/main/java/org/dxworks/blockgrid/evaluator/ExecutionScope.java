package org.dxworks.blockgrid.evaluator;

import java.util.HashMap;
import java.util.Map;

/**
 * Variable bindings for one cell. Created per cell and dropped afterwards.
 */
public final class ExecutionScope {

    public static final String X = "x";
    public static final String Y = "y";
    public static final String PIXEL = "p";
    public static final String UNSET_PIXEL = "";

    private final Map<String, Object> variables = new HashMap<>();

    private ExecutionScope() {
    }

    public static ExecutionScope forCell(int x, int y) {
        ExecutionScope scope = new ExecutionScope();
        scope.variables.put(X, x);
        scope.variables.put(Y, y);
        scope.variables.put(PIXEL, UNSET_PIXEL);
        return scope;
    }

    public Object lookup(String name) {
        Object value = variables.get(name);
        if (value == null) {
            throw new EvaluationException("Undefined variable: " + name);
        }
        return value;
    }

    public void assign(String name, Object value) {
        variables.put(name, value);
    }

    public Object pixel() {
        return variables.get(PIXEL);
    }
}
