package nl.bytesoflife.proteintea.technical;

/**
 * Mass flows and compositions of one fractionation run.
 *
 * @param inputMassKg                  pea flour fed to the run, kg
 * @param proteinConcentrateMassKg     protein-rich fraction collected, kg
 * @param initialProteinContentPercent protein content of the feed, %
 * @param outputProteinContentPercent  protein content of the concentrate, %
 * @param initialMoisturePercent       moisture of the feed, %
 * @param finalMoisturePercent         moisture after treatment, %
 * @param runsPerYear                  runs per operating year
 */
public record TechnicalParameters(
        double inputMassKg,
        double proteinConcentrateMassKg,
        double initialProteinContentPercent,
        double outputProteinContentPercent,
        double initialMoisturePercent,
        double finalMoisturePercent,
        int runsPerYear
) {
}
