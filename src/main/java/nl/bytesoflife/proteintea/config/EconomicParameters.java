package nl.bytesoflife.proteintea.config;

import nl.bytesoflife.proteintea.economic.CostInputs;
import nl.bytesoflife.proteintea.economic.sensitivity.SensitivityConfig;

/**
 * Economic inputs of an analysis.
 *
 * @param costInputs        capital and operating costs
 * @param discountRate      discount rate for NPV, 0 ≤ r &lt; 1
 * @param sellingPricePerKg product selling price, USD/kg
 * @param sensitivity       sensitivity analysis settings
 */
public record EconomicParameters(
        CostInputs costInputs,
        double discountRate,
        double sellingPricePerKg,
        SensitivityConfig sensitivity
) {

    public EconomicParameters {
        if (costInputs == null) {
            throw new IllegalArgumentException("Cost inputs must not be null");
        }
        if (sensitivity == null) {
            sensitivity = SensitivityConfig.defaults().withSellingPrice(sellingPricePerKg);
        }
    }

    public static EconomicParameters defaults() {
        return BuiltinParameters.economic();
    }

    public EconomicParameters withCostInputs(CostInputs costInputs) {
        return new EconomicParameters(costInputs, discountRate, sellingPricePerKg, sensitivity);
    }

    public EconomicParameters withProductionVolume(double productionVolumeKgPerYear) {
        return withCostInputs(costInputs.withProductionVolume(productionVolumeKgPerYear));
    }

    /**
     * Changes the selling price of both the profitability and the sensitivity analysis.
     */
    public EconomicParameters withSellingPrice(double sellingPricePerKg) {
        return new EconomicParameters(costInputs, discountRate, sellingPricePerKg,
                sensitivity.withSellingPrice(sellingPricePerKg));
    }

    public EconomicParameters withDiscountRate(double discountRate) {
        return new EconomicParameters(costInputs, discountRate, sellingPricePerKg, sensitivity);
    }

    public EconomicParameters withSensitivity(SensitivityConfig sensitivity) {
        return new EconomicParameters(costInputs, discountRate, sellingPricePerKg, sensitivity);
    }
}
