package nl.bytesoflife.proteintea.economic;

/**
 * Discounting of a constant annual cash flow, the cash-flow model of the profitability metrics.
 */
public final class DiscountedCashFlow {

    private DiscountedCashFlow() {
    }

    /**
     * Present value of 1 USD received at the end of each year for {@code years} years.
     */
    public static double annuityFactor(double rate, int years) {
        double factor = 0;
        for (int t = 1; t <= years; t++) {
            factor += 1.0 / Math.pow(1 + rate, t);
        }
        return factor;
    }

    /**
     * Net present value of an up-front investment followed by a constant annual cash flow.
     */
    public static double npv(double investment, double annualCashFlow, double rate, int years) {
        return -investment + annualCashFlow * annuityFactor(rate, years);
    }
}
