package nl.bytesoflife.proteintea.economic;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolver;

/**
 * Solves NPV(r) = 0 for a constant annual cash flow.
 * The root is bracketed on (-0.99, upper], doubling the upper bound until the NPV turns negative.
 */
public class IrrSolver {

    static final double LOWER_RATE = -0.99;
    static final double MAX_RATE = 1024.0;
    private static final int MAX_EVALUATIONS = 500;

    private final UnivariateSolver solver = new BrentSolver(1e-12);

    /**
     * @return the rate as a fraction (0.12 = 12%), or null when no rate zeroes the NPV
     */
    public Double solve(double investment, double annualCashFlow, int years) {
        if (annualCashFlow <= 0 || investment <= 0 || years <= 0) {
            return null;
        }
        UnivariateFunction npv = rate -> DiscountedCashFlow.npv(investment, annualCashFlow, rate, years);

        if (npv.value(LOWER_RATE) < 0) {
            return null;
        }
        double upper = 1.0;
        while (npv.value(upper) > 0) {
            if (upper >= MAX_RATE) {
                return null;
            }
            upper *= 2;
        }
        return solver.solve(MAX_EVALUATIONS, npv, LOWER_RATE, upper);
    }
}
