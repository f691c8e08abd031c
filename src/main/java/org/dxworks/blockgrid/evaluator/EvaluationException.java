package org.dxworks.blockgrid.evaluator;

/**
 * Aborts the evaluation of one grid cell. Never escapes {@link GridEvaluator}.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }
}
