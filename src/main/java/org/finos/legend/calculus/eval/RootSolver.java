package org.finos.legend.calculus.eval;

/**
 * Computes real nth roots by fixed-point Newton iteration.
 */
public final class RootSolver {

    private RootSolver() {
    }

    /**
     * Iterates {@code g <- ((n-1)g + x / g^(n-1)) / n} starting from {@code g = x}.
     * A second sequence advances two steps per round; the loop stops when both
     * sequences meet, which is the floating point fixed point of the update.
     *
     * @param x The radicand, strictly positive
     * @param n The root degree, at least 2
     * @return The non-negative real root
     * @throws InvalidDomainException if {@code n < 2} or {@code x <= 0}
     */
    public static double nthRoot(double x, int n) {
        if (n < 2) {
            throw new InvalidDomainException("n must be more than 1, was " + n);
        }
        if (x <= 0.0) {
            throw new InvalidDomainException("x must be positive, was " + x);
        }
        double g1 = x;
        double g2 = step(g1, x, n);
        while (g1 != g2) {
            g1 = step(g1, x, n);
            g2 = step(step(g2, x, n), x, n);
        }
        return g1;
    }

    private static double step(double g, double x, int n) {
        int np = n - 1;
        return (np * g + x / Math.pow(g, np)) / n;
    }
}
