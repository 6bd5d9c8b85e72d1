package nl.bytesoflife.proteintea.economic;

import nl.bytesoflife.proteintea.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static nl.bytesoflife.proteintea.InputChecks.requireFinite;
import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;
import static nl.bytesoflife.proteintea.InputChecks.requirePositive;

/**
 * Converts annual costs and revenue assumptions into ROI, payback period, NPV and IRR.
 *
 * <p>The cash flow is assumed constant over the project duration. The reported
 * {@code irrPercent} keeps the linearized estimate existing consumers expect;
 * the root-solved rate is reported next to it as {@code exactIrrPercent}.
 */
public class ProfitabilityModel {

    private static final Logger log = LoggerFactory.getLogger(ProfitabilityModel.class);

    private final IrrSolver irrSolver = new IrrSolver();

    public ProfitabilityMetrics calculate(ProfitabilityInputs inputs) {
        validate(inputs);

        int years = inputs.projectDurationYears();
        double rate = inputs.discountRate();
        double investment = inputs.totalInvestment();
        double revenue = inputs.productionVolume() * inputs.sellingPricePerKg();
        double profit = revenue - inputs.totalAnnualCost();

        double roi = profit / investment * 100;
        Double payback = profit > 0 ? investment / profit : null;
        double npv = DiscountedCashFlow.npv(investment, profit, rate, years);
        double irr = ((profit * years - investment) / investment) / years * 100;

        Double exactRate = irrSolver.solve(investment, profit, years);
        Double exactIrr = exactRate != null ? exactRate * 100 : null;
        if (exactIrr == null) {
            log.warn("No discount rate zeroes the NPV (annual profit {} USD), exact IRR undefined", profit);
        }

        double breakEvenProfit = investment / DiscountedCashFlow.annuityFactor(rate, years);
        double breakEvenPrice = (breakEvenProfit + inputs.totalAnnualCost()) / inputs.productionVolume();

        log.debug("Profit {} USD/yr, ROI {}%, NPV {} USD, IRR {}% (approx) / {}% (exact)",
                profit, roi, npv, irr, exactIrr);
        return new ProfitabilityMetrics(revenue, profit, investment, roi, payback, npv,
                irr, exactIrr, breakEvenPrice);
    }

    private void validate(ProfitabilityInputs inputs) {
        requireNonNegative("total_annual_cost", inputs.totalAnnualCost());
        requirePositive("production_volume", inputs.productionVolume());
        requirePositive("project_duration", inputs.projectDurationYears());
        requireFinite("discount_rate", inputs.discountRate());
        if (inputs.discountRate() < 0 || inputs.discountRate() >= 1) {
            throw new InvalidInputException("discount_rate", inputs.discountRate(), "must be in [0, 1)");
        }
        requireNonNegative("equipment_cost", inputs.equipmentCost());
        requireNonNegative("installation_factor", inputs.installationFactor());
        requireNonNegative("selling_price_per_kg", inputs.sellingPricePerKg());
        if (inputs.totalInvestment() <= 0) {
            throw new InvalidInputException("equipment_cost", inputs.equipmentCost(),
                    "must give a positive total investment");
        }
    }
}
