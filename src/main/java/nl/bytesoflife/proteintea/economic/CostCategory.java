package nl.bytesoflife.proteintea.economic;

/**
 * Annualized cost categories, with the snake_case keys used by report consumers.
 */
public enum CostCategory {
    EQUIPMENT("equipment"),
    MAINTENANCE("maintenance"),
    RAW_MATERIAL("raw_material"),
    UTILITIES("utilities"),
    LABOR("labor"),
    INDIRECT("indirect");

    private final String key;

    CostCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static CostCategory fromKey(String key) {
        for (CostCategory category : values()) {
            if (category.key.equals(key)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown cost category: " + key);
    }
}
