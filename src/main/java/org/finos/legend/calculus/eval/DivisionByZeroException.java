package org.finos.legend.calculus.eval;

public class DivisionByZeroException extends EvaluationException {

    public DivisionByZeroException(String message) {
        super(message);
    }
}
