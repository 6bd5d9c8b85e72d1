package nl.bytesoflife.proteintea.economic;

/**
 * Profitability of the process under a constant annual cash flow.
 *
 * @param annualRevenue              production volume times selling price, USD/year
 * @param annualProfit               revenue minus total annual cost, USD/year
 * @param totalInvestment            installed equipment cost, USD
 * @param roiPercent                 annual profit over total investment, %
 * @param paybackPeriodYears         investment over annual profit, or null when the process is not profitable
 * @param npv                        net present value over the project duration, USD
 * @param irrPercent                 linearized IRR estimate ({@link IrrMethod#APPROXIMATE}), %
 * @param exactIrrPercent            root-solved IRR ({@link IrrMethod#EXACT}), %, or null when no rate zeroes the NPV
 * @param breakEvenSellingPricePerKg selling price at which the NPV is zero, USD/kg
 */
public record ProfitabilityMetrics(
        double annualRevenue,
        double annualProfit,
        double totalInvestment,
        double roiPercent,
        Double paybackPeriodYears,
        double npv,
        double irrPercent,
        Double exactIrrPercent,
        double breakEvenSellingPricePerKg
) {

    public boolean isProfitable() {
        return annualProfit > 0;
    }

    public boolean hasPaybackPeriod() {
        return paybackPeriodYears != null;
    }

    public Double irrPercent(IrrMethod method) {
        return switch (method) {
            case APPROXIMATE -> irrPercent;
            case EXACT -> exactIrrPercent;
        };
    }
}
