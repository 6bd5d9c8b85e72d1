package nl.bytesoflife.proteintea.environmental.allocation;

/**
 * An output of the process that carries a share of the burdens.
 *
 * @param name       product name, unique within one allocation
 * @param massKg     produced mass, kg
 * @param pricePerKg market price, USD/kg, or null when unknown (mass allocation only)
 */
public record CoProduct(String name, double massKg, Double pricePerKg) {

    public CoProduct {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Co-product name must not be blank");
        }
    }

    public static CoProduct ofMass(String name, double massKg) {
        return new CoProduct(name, massKg, null);
    }

    public boolean hasPrice() {
        return pricePerKg != null;
    }

    /**
     * Market value of the produced mass, USD; 0 when the price is unknown.
     */
    public double value() {
        return pricePerKg == null ? 0 : massKg * pricePerKg;
    }
}
