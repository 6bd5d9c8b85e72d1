package nl.bytesoflife.proteintea;

import nl.bytesoflife.proteintea.economic.CostReport;
import nl.bytesoflife.proteintea.economic.ProfitabilityMetrics;
import nl.bytesoflife.proteintea.economic.sensitivity.SensitivityReport;

/**
 * Results of the economic branch.
 */
public record EconomicAnalysis(
        CostReport costReport,
        ProfitabilityMetrics profitability,
        SensitivityReport sensitivity
) {
}
