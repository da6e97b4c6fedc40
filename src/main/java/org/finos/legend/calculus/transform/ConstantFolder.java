package org.finos.legend.calculus.transform;

import org.finos.legend.calculus.eval.EvaluationException;
import org.finos.legend.calculus.eval.Evaluator;
import org.finos.legend.calculus.expr.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Evaluates variable-free subtrees for the rewrite rules.
 *
 * A subtree whose evaluation fails or yields NaN/infinity has no value here;
 * the caller keeps it symbolic.
 */
final class ConstantFolder {

    private static final Logger LOG = LoggerFactory.getLogger(ConstantFolder.class);

    private ConstantFolder() {
    }

    static OptionalDouble valueOf(Expression expression) {
        if (!expression.isConstant()) {
            return OptionalDouble.empty();
        }
        double value;
        try {
            value = Evaluator.empty().evaluate(expression);
        } catch (EvaluationException e) {
            LOG.debug("Keeping {} symbolic: {}", expression, e.getMessage());
            return OptionalDouble.empty();
        }
        if (!Double.isFinite(value)) {
            LOG.debug("Keeping {} symbolic: evaluates to {}", expression, value);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value);
    }
}
