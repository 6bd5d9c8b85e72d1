package nl.bytesoflife.proteintea.sustainability;

/**
 * RF operating metrics that can be checked against a benchmark band.
 */
public enum BandMetric {
    TEMPERATURE_OUTFEED("temperature_outfeed", "°C"),
    TEMPERATURE_ELECTRODE("temperature_electrode", "°C"),
    ENERGY_CONTRIBUTION("energy_contribution", "%"),
    ANODE_CURRENT("anode_current", "A"),
    GRID_CURRENT("grid_current", "A");

    private final String key;
    private final String unit;

    BandMetric(String key, String unit) {
        this.key = key;
        this.unit = unit;
    }

    public String key() {
        return key;
    }

    public String unit() {
        return unit;
    }

    /**
     * The measured value, or null when the parameters do not carry it.
     */
    public Double get(RfProcessParameters rf) {
        return switch (this) {
            case TEMPERATURE_OUTFEED -> rf.temperatureOutfeedC();
            case TEMPERATURE_ELECTRODE -> rf.temperatureElectrodeC();
            case ENERGY_CONTRIBUTION -> rf.energyContributionPercent();
            case ANODE_CURRENT -> rf.anodeCurrentA();
            case GRID_CURRENT -> rf.gridCurrentA();
        };
    }
}
