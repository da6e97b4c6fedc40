package org.finos.legend.calculus.transform;

import org.finos.legend.calculus.expr.Expression;
import org.finos.legend.calculus.expr.NthRoot;
import org.finos.legend.calculus.expr.Variable;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Decides whether two subtrees are interchangeable for rewrite rules.
 *
 * Two expressions are equivalent when
 * <ul>
 * <li>both are variable-free and evaluate to the same number, or</li>
 * <li>both are the same variable, or</li>
 * <li>they are the same variant with pairwise equivalent children.</li>
 * </ul>
 * Different variants are never equivalent unless both are constant, so
 * {@code sin(x)} and {@code cos(x)} do not match.
 */
public final class StructuralEquality {

    private StructuralEquality() {
    }

    public static boolean equivalent(Expression a, Expression b) {
        if (a == b || a.equals(b)) {
            return true;
        }
        if (a.isConstant() && b.isConstant()) {
            OptionalDouble left = ConstantFolder.valueOf(a);
            OptionalDouble right = ConstantFolder.valueOf(b);
            if (left.isPresent() && right.isPresent()) {
                return left.getAsDouble() == right.getAsDouble();
            }
        }
        if (a.getClass() != b.getClass()) {
            return false;
        }
        if (a instanceof Variable va && b instanceof Variable vb) {
            return va.symbol() == vb.symbol();
        }
        if (a instanceof NthRoot ra && b instanceof NthRoot rb && ra.degree() != rb.degree()) {
            return false;
        }
        List<Expression> leftChildren = a.children();
        List<Expression> rightChildren = b.children();
        if (leftChildren.isEmpty() || leftChildren.size() != rightChildren.size()) {
            return false;
        }
        for (int i = 0; i < leftChildren.size(); i++) {
            if (!equivalent(leftChildren.get(i), rightChildren.get(i))) {
                return false;
            }
        }
        return true;
    }
}
