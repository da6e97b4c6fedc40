package org.finos.legend.calculus.eval;

/**
 * Exception thrown when an expression cannot be evaluated to a number.
 * Evaluation fails fast: no partial result is produced.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
