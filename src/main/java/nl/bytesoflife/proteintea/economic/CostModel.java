package nl.bytesoflife.proteintea.economic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;
import static nl.bytesoflife.proteintea.InputChecks.requirePositive;

/**
 * Converts capital and operating inputs into an annualized cost breakdown.
 * Equipment is amortized linearly over the project duration, including installation.
 */
public class CostModel {

    private static final Logger log = LoggerFactory.getLogger(CostModel.class);

    public CostReport calculate(CostInputs inputs) {
        validate(inputs);

        double volume = inputs.productionVolumeKgPerYear();
        Map<CostCategory, Double> amounts = new EnumMap<>(CostCategory.class);
        amounts.put(CostCategory.EQUIPMENT, inputs.totalInvestment() / inputs.projectDurationYears());
        amounts.put(CostCategory.MAINTENANCE, inputs.maintenanceCost());
        amounts.put(CostCategory.RAW_MATERIAL, inputs.rawMaterialCostPerKg() * volume);
        amounts.put(CostCategory.UTILITIES, inputs.utilityCostPerKg() * volume);
        amounts.put(CostCategory.LABOR, inputs.laborCostPerKg() * volume);
        amounts.put(CostCategory.INDIRECT, inputs.equipmentCost() * inputs.indirectCostsFactor());

        CostReport report = new CostReport(new AnnualCostBreakdown(amounts), volume, inputs.totalInvestment());
        log.debug("Annual cost {} USD over {} kg/yr, unit cost {} USD/kg",
                report.getTotalAnnualCost(), volume, report.getUnitCost());
        return report;
    }

    private void validate(CostInputs inputs) {
        requireNonNegative("equipment_cost", inputs.equipmentCost());
        requireNonNegative("installation_factor", inputs.installationFactor());
        requireNonNegative("maintenance_cost", inputs.maintenanceCost());
        requireNonNegative("raw_material_cost_per_kg", inputs.rawMaterialCostPerKg());
        requireNonNegative("utility_cost_per_kg", inputs.utilityCostPerKg());
        requireNonNegative("labor_cost_per_kg", inputs.laborCostPerKg());
        requireNonNegative("indirect_costs_factor", inputs.indirectCostsFactor());
        requirePositive("production_volume", inputs.productionVolumeKgPerYear());
        requirePositive("project_duration", inputs.projectDurationYears());
    }
}
