package nl.bytesoflife.proteintea.environmental;

/**
 * Life-cycle impact categories evaluated for the process.
 */
public enum ImpactCategory {
    GWP("gwp", "Global Warming Potential", Unit.KG_CO2_EQ),
    HCT("hct", "Human Carcinogenic Toxicity", Unit.CTUH),
    FRS("frs", "Fossil Resource Scarcity", Unit.KG_OIL_EQ),
    WATER_CONSUMPTION("water_consumption", "Water Consumption", Unit.KG_WATER);

    private final String key;
    private final String displayName;
    private final Unit unit;

    ImpactCategory(String key, String displayName, Unit unit) {
        this.key = key;
        this.displayName = displayName;
        this.unit = unit;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public Unit unit() {
        return unit;
    }

    public static ImpactCategory fromKey(String key) {
        for (ImpactCategory category : values()) {
            if (category.key.equals(key)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown impact category: " + key);
    }
}
