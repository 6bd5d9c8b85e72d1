package nl.bytesoflife.proteintea.environmental;

/**
 * The activity quantity an impact factor is multiplied by.
 */
public enum ImpactDriver {
    ELECTRICITY_KWH,
    WATER_KG,
    TRANSPORT_TON_KM,
    WASTE_KG,
    THERMALLY_PROCESSED_KG,
    MECHANICALLY_PROCESSED_KG,
    PRODUCT_KG,
    EQUIPMENT_KG,
    COOLING_KWH;

    /**
     * The driver quantity for the given inputs, or null when the step does not apply.
     */
    public Double resolve(ImpactInputs inputs) {
        ConsumptionMetrics consumption = inputs.consumption();
        return switch (this) {
            case ELECTRICITY_KWH -> consumption.electricityKwh();
            case WATER_KG -> consumption.waterKg();
            case TRANSPORT_TON_KM -> inputs.transportTonKm();
            case WASTE_KG -> inputs.wasteKg();
            case THERMALLY_PROCESSED_KG -> inputs.thermallyProcessedKg();
            case MECHANICALLY_PROCESSED_KG -> inputs.mechanicallyProcessedKg();
            case PRODUCT_KG -> inputs.productMassKg();
            case EQUIPMENT_KG -> inputs.equipmentMassKg();
            case COOLING_KWH -> consumption.coolingKwh();
        };
    }
}
