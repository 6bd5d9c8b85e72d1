package nl.bytesoflife.proteintea.economic.sensitivity;

/**
 * Cost drivers covered by the sensitivity analysis.
 */
public enum SensitivityParameter {
    EQUIPMENT_COST("equipment_cost", "Equipment Cost"),
    MAINTENANCE_COST("maintenance_cost", "Maintenance Cost"),
    RAW_MATERIAL_COST("raw_material_cost", "Raw Material Cost"),
    UTILITY_COST("utility_cost", "Utility Cost"),
    LABOR_COST("labor_cost", "Labor Cost"),
    PRODUCTION_VOLUME("production_volume", "Production Volume");

    private final String key;
    private final String displayName;

    SensitivityParameter(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public double get(SensitivityInputs inputs) {
        return switch (this) {
            case EQUIPMENT_COST -> inputs.equipmentCost();
            case MAINTENANCE_COST -> inputs.maintenanceCost();
            case RAW_MATERIAL_COST -> inputs.rawMaterialCost();
            case UTILITY_COST -> inputs.utilityCost();
            case LABOR_COST -> inputs.laborCost();
            case PRODUCTION_VOLUME -> inputs.productionVolume();
        };
    }

    /**
     * Copy of the inputs with this parameter replaced by {@code value}.
     */
    public SensitivityInputs with(SensitivityInputs inputs, double value) {
        return new SensitivityInputs(
                this == EQUIPMENT_COST ? value : inputs.equipmentCost(),
                this == MAINTENANCE_COST ? value : inputs.maintenanceCost(),
                this == RAW_MATERIAL_COST ? value : inputs.rawMaterialCost(),
                this == UTILITY_COST ? value : inputs.utilityCost(),
                this == LABOR_COST ? value : inputs.laborCost(),
                this == PRODUCTION_VOLUME ? value : inputs.productionVolume());
    }
}
