package nl.bytesoflife.proteintea.economic;

/**
 * Capital and operating inputs for the annual cost model.
 *
 * @param equipmentCost             purchased equipment cost, USD
 * @param installationFactor        installation cost as a fraction of equipment cost
 * @param maintenanceCost           annual maintenance cost, USD/year
 * @param rawMaterialCostPerKg      raw material cost per kg of product, USD/kg
 * @param utilityCostPerKg          utility cost per kg of product, USD/kg
 * @param laborCostPerKg            labor cost per kg of product, USD/kg
 * @param indirectCostsFactor       indirect costs as a fraction of equipment cost
 * @param productionVolumeKgPerYear annual production volume, kg/year
 * @param projectDurationYears      project lifetime used for amortization, years
 */
public record CostInputs(
        double equipmentCost,
        double installationFactor,
        double maintenanceCost,
        double rawMaterialCostPerKg,
        double utilityCostPerKg,
        double laborCostPerKg,
        double indirectCostsFactor,
        double productionVolumeKgPerYear,
        int projectDurationYears
) {

    public CostInputs withProductionVolume(double productionVolumeKgPerYear) {
        return new CostInputs(equipmentCost, installationFactor, maintenanceCost,
                rawMaterialCostPerKg, utilityCostPerKg, laborCostPerKg,
                indirectCostsFactor, productionVolumeKgPerYear, projectDurationYears);
    }

    /**
     * Installed equipment cost, the capital investment of the project.
     */
    public double totalInvestment() {
        return equipmentCost * (1 + installationFactor);
    }
}
