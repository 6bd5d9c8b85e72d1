package nl.bytesoflife.proteintea.environmental;

/**
 * Resource consumption of one process run.
 * Null cooling or thermal energy means the process variant has no such step, which is
 * not the same as a step that consumed zero.
 *
 * @param electricityKwh electricity consumed, kWh
 * @param waterKg        water consumed, kg
 * @param coolingKwh     cooling energy, kWh, or null when not applicable
 * @param thermalKwh     thermal treatment energy, kWh, or null when not applicable
 */
public record ConsumptionMetrics(
        double electricityKwh,
        double waterKg,
        Double coolingKwh,
        Double thermalKwh
) {

    public static ConsumptionMetrics of(double electricityKwh, double waterKg) {
        return new ConsumptionMetrics(electricityKwh, waterKg, null, null);
    }

    /**
     * Electricity plus the cooling and thermal energy that apply.
     */
    public double totalEnergyKwh() {
        double total = electricityKwh;
        if (coolingKwh != null) total += coolingKwh;
        if (thermalKwh != null) total += thermalKwh;
        return total;
    }
}
