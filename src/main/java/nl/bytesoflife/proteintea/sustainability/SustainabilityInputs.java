package nl.bytesoflife.proteintea.sustainability;

import nl.bytesoflife.proteintea.environmental.IntensityMetrics;

/**
 * Process figures the sustainability score is computed from.
 *
 * @param totalMassKg              total processed mass, kg
 * @param proteinConcentrateMassKg protein concentrate produced, kg
 * @param energyIntensity          kWh per kg
 * @param waterIntensity           kg water per kg
 * @param rf                       RF operating point, or null for the process without RF pretreatment
 */
public record SustainabilityInputs(
        double totalMassKg,
        double proteinConcentrateMassKg,
        double energyIntensity,
        double waterIntensity,
        RfProcessParameters rf
) {

    public static SustainabilityInputs of(IntensityMetrics intensity, double proteinConcentrateMassKg,
                                          RfProcessParameters rf) {
        return new SustainabilityInputs(intensity.totalMassKg(), proteinConcentrateMassKg,
                intensity.energyIntensity(), intensity.waterIntensity(), rf);
    }

    public boolean hasRfTreatment() {
        return rf != null;
    }

    public double proteinYieldPercent() {
        return proteinConcentrateMassKg / totalMassKg * 100;
    }
}
