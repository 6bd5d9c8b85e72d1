package nl.bytesoflife.proteintea.economic.sensitivity;

import nl.bytesoflife.proteintea.InvalidInputException;

import static nl.bytesoflife.proteintea.InputChecks.requireFinite;
import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;
import static nl.bytesoflife.proteintea.InputChecks.requirePositive;

/**
 * Settings of the sensitivity analysis.
 *
 * @param sellingPricePerKg selling price used for the profit, USD/kg
 * @param depreciationYears years over which equipment cost is spread in the profit
 * @param perturbation      relative change applied by the point analysis (0.10 = +10%)
 * @param sensitivityRange  half-width of the curve analysis, as a fraction of the base value
 * @param steps             number of intervals of the curve analysis
 */
public record SensitivityConfig(
        double sellingPricePerKg,
        int depreciationYears,
        double perturbation,
        double sensitivityRange,
        int steps
) {

    public static final double DEFAULT_SELLING_PRICE_PER_KG = 5.0;
    public static final int DEFAULT_DEPRECIATION_YEARS = 10;
    public static final double DEFAULT_PERTURBATION = 0.10;
    public static final double DEFAULT_SENSITIVITY_RANGE = 0.2;
    public static final int DEFAULT_STEPS = 10;

    public SensitivityConfig {
        requireNonNegative("selling_price_per_kg", sellingPricePerKg);
        requirePositive("depreciation_years", depreciationYears);
        requireFinite("perturbation", perturbation);
        if (perturbation == 0) {
            throw new InvalidInputException("perturbation", perturbation, "must not be zero");
        }
        requireNonNegative("sensitivity_range", sensitivityRange);
        requirePositive("steps", steps);
    }

    public static SensitivityConfig defaults() {
        return new SensitivityConfig(DEFAULT_SELLING_PRICE_PER_KG, DEFAULT_DEPRECIATION_YEARS,
                DEFAULT_PERTURBATION, DEFAULT_SENSITIVITY_RANGE, DEFAULT_STEPS);
    }

    public SensitivityConfig withSellingPrice(double sellingPricePerKg) {
        return new SensitivityConfig(sellingPricePerKg, depreciationYears, perturbation, sensitivityRange, steps);
    }
}
