package org.finos.legend.calculus.eval;

/**
 * Thrown when a variable has no entry in the evaluation bindings.
 */
public class UnboundVariableException extends EvaluationException {

    private final char symbol;

    public UnboundVariableException(char symbol) {
        super("'" + symbol + "' was not defined");
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
