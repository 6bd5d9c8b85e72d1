package nl.bytesoflife.proteintea.environmental.allocation;

import java.util.Locale;

/**
 * How burdens are split between co-products.
 */
public enum AllocationMethod {
    /** Proportional to mass. Also known as physical allocation. */
    MASS("mass"),
    /** Proportional to market value (mass times price). */
    ECONOMIC("economic"),
    /** Weighted blend of economic and mass shares. */
    HYBRID("hybrid");

    private final String key;

    AllocationMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean requiresPrices() {
        return this != MASS;
    }

    public static AllocationMethod fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("physical")) {
            return MASS;
        }
        for (AllocationMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown allocation method: " + key);
    }
}
