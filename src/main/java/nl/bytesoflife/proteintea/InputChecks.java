package nl.bytesoflife.proteintea;

/**
 * Boundary checks shared by the calculation components.
 */
public final class InputChecks {

    private InputChecks() {
    }

    public static double requireFinite(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidInputException(field, value, "must be a finite number");
        }
        return value;
    }

    public static double requireNonNegative(String field, double value) {
        requireFinite(field, value);
        if (value < 0) {
            throw new InvalidInputException(field, value, "must not be negative");
        }
        return value;
    }

    public static double requirePositive(String field, double value) {
        requireFinite(field, value);
        if (value <= 0) {
            throw new InvalidInputException(field, value, "must be greater than zero");
        }
        return value;
    }

    public static double requireFraction(String field, double value) {
        requireFinite(field, value);
        if (value < 0 || value > 1) {
            throw new InvalidInputException(field, value, "must be between 0 and 1");
        }
        return value;
    }
}
