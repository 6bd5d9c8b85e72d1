package nl.bytesoflife.proteintea.sustainability;

/**
 * The weighted parts of the sustainability score.
 */
public enum ScoreComponent {
    RF_TREATMENT_EFFICIENCY("rf_treatment_efficiency"),
    PROCESS_EFFICIENCY("process_efficiency"),
    ENERGY_EFFICIENCY("energy_efficiency"),
    RESOURCE_CONSERVATION("resource_conservation");

    private final String key;

    ScoreComponent(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
