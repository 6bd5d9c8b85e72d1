package nl.bytesoflife.proteintea.environmental;

/**
 * Everything the impact model needs about one process run.
 *
 * @param consumption            resource consumption
 * @param transportTonKm         transport work, ton-km
 * @param wasteKg                waste generated, kg
 * @param productMassKg          total product mass, kg
 * @param equipmentMassKg        equipment mass cleaned, kg
 * @param thermalProcessingShare fraction of the product that passes thermal treatment, 0..1
 */
public record ImpactInputs(
        ConsumptionMetrics consumption,
        double transportTonKm,
        double wasteKg,
        double productMassKg,
        double equipmentMassKg,
        double thermalProcessingShare
) {

    public double thermallyProcessedKg() {
        return productMassKg * thermalProcessingShare;
    }

    public double mechanicallyProcessedKg() {
        return productMassKg * (1 - thermalProcessingShare);
    }
}
