package nl.bytesoflife.proteintea.environmental;

/**
 * Units carried by impact contributions: the absolute category units and
 * their per-kilogram-of-product variants.
 */
public enum Unit {
    KG_CO2_EQ("kg_CO2_eq"),
    CTUH("CTUh"),
    KG_OIL_EQ("kg_oil_eq"),
    KG_WATER("kg_water"),
    KG_CO2_EQ_PER_KG("kg_CO2_eq/kg"),
    CTUH_PER_KG("CTUh/kg"),
    KG_OIL_EQ_PER_KG("kg_oil_eq/kg"),
    KG_WATER_PER_KG("kg_water/kg");

    private final String symbol;

    Unit(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPerKilogram() {
        return switch (this) {
            case KG_CO2_EQ_PER_KG, CTUH_PER_KG, KG_OIL_EQ_PER_KG, KG_WATER_PER_KG -> true;
            default -> false;
        };
    }

    /**
     * The per-kg-product variant of this unit. Per-kg units map to themselves.
     */
    public Unit perKilogram() {
        return switch (this) {
            case KG_CO2_EQ, KG_CO2_EQ_PER_KG -> KG_CO2_EQ_PER_KG;
            case CTUH, CTUH_PER_KG -> CTUH_PER_KG;
            case KG_OIL_EQ, KG_OIL_EQ_PER_KG -> KG_OIL_EQ_PER_KG;
            case KG_WATER, KG_WATER_PER_KG -> KG_WATER_PER_KG;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
