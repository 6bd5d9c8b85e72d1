package nl.bytesoflife.proteintea.environmental;

/**
 * Resource intensities of a process run.
 *
 * @param totalMassKg         product mass the intensities are normalized by, kg
 * @param totalEnergyKwh      electricity plus applicable cooling and thermal energy, kWh
 * @param energyIntensity     kWh per kg product
 * @param waterIntensity      kg water per kg product
 * @param thermalRatio        thermal share of the total energy, or null when there is no
 *                            thermal step or no energy at all
 */
public record IntensityMetrics(
        double totalMassKg,
        double totalEnergyKwh,
        double energyIntensity,
        double waterIntensity,
        Double thermalRatio
) {

    public static IntensityMetrics of(ConsumptionMetrics consumption, double totalMassKg) {
        double totalEnergy = consumption.totalEnergyKwh();
        Double thermalRatio = null;
        if (consumption.thermalKwh() != null && totalEnergy > 0) {
            thermalRatio = consumption.thermalKwh() / totalEnergy;
        }
        return new IntensityMetrics(totalMassKg, totalEnergy,
                totalEnergy / totalMassKg,
                consumption.waterKg() / totalMassKg,
                thermalRatio);
    }
}
