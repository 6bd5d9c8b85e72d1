package nl.bytesoflife.proteintea.technical;

/**
 * Mass and protein balance of a run.
 *
 * @param proteinYieldPercent          concentrate mass as a share of the feed, %
 * @param recoveryRatePercent          feed protein that ends up in the concentrate, %
 * @param concentrationFactor          output over input protein content
 * @param proteinLossKg                feed protein not recovered, kg
 * @param moistureReductionPercent     moisture points removed
 * @param annualProductionVolumeKg     concentrate produced per year, kg
 */
public record ProteinRecovery(
        double proteinYieldPercent,
        double recoveryRatePercent,
        double concentrationFactor,
        double proteinLossKg,
        double moistureReductionPercent,
        double annualProductionVolumeKg
) {
}
