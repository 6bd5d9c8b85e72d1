package nl.bytesoflife.proteintea.economic;

/**
 * Inputs of the profitability model.
 *
 * @param totalAnnualCost      total annual cost, USD/year
 * @param productionVolume     annual production volume, kg/year
 * @param projectDurationYears project lifetime, years
 * @param discountRate         annual discount rate as a fraction, 0 &lt;= r &lt; 1
 * @param equipmentCost        purchased equipment cost, USD
 * @param installationFactor   installation cost as a fraction of equipment cost
 * @param sellingPricePerKg    product selling price, USD/kg
 */
public record ProfitabilityInputs(
        double totalAnnualCost,
        double productionVolume,
        int projectDurationYears,
        double discountRate,
        double equipmentCost,
        double installationFactor,
        double sellingPricePerKg
) {

    public static ProfitabilityInputs of(CostInputs costInputs, CostReport costReport,
                                         double discountRate, double sellingPricePerKg) {
        return new ProfitabilityInputs(
                costReport.getTotalAnnualCost(),
                costInputs.productionVolumeKgPerYear(),
                costInputs.projectDurationYears(),
                discountRate,
                costInputs.equipmentCost(),
                costInputs.installationFactor(),
                sellingPricePerKg);
    }

    public double totalInvestment() {
        return equipmentCost * (1 + installationFactor);
    }
}
