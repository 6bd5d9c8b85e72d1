package nl.bytesoflife.proteintea.economic.sensitivity;

import nl.bytesoflife.proteintea.economic.CostInputs;

/**
 * Base values of the cost drivers perturbed by the sensitivity analysis.
 *
 * @param equipmentCost    purchased equipment cost, USD
 * @param maintenanceCost  annual maintenance cost, USD/year
 * @param rawMaterialCost  raw material cost, USD/kg
 * @param utilityCost      utility cost, USD/kg
 * @param laborCost        labor cost, USD/kg
 * @param productionVolume annual production volume, kg/year
 */
public record SensitivityInputs(
        double equipmentCost,
        double maintenanceCost,
        double rawMaterialCost,
        double utilityCost,
        double laborCost,
        double productionVolume
) {

    public static SensitivityInputs from(CostInputs costInputs) {
        return new SensitivityInputs(
                costInputs.equipmentCost(),
                costInputs.maintenanceCost(),
                costInputs.rawMaterialCostPerKg(),
                costInputs.utilityCostPerKg(),
                costInputs.laborCostPerKg(),
                costInputs.productionVolumeKgPerYear());
    }
}
