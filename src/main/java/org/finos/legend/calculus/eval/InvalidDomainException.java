package org.finos.legend.calculus.eval;

/**
 * Thrown when a numeric routine is called outside the domain it supports.
 */
public class InvalidDomainException extends EvaluationException {

    public InvalidDomainException(String message) {
        super(message);
    }
}
