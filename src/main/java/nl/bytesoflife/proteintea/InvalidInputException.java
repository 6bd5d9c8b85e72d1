package nl.bytesoflife.proteintea;

import java.util.Locale;

/**
 * Thrown when a component receives an input value it cannot compute with,
 * such as a non-positive denominator or a negative cost.
 * The offending field is reported by its snake_case name.
 */
public class InvalidInputException extends IllegalArgumentException {

    private final String field;
    private final double value;

    public InvalidInputException(String field, double value, String reason) {
        super(String.format(Locale.US, "%s %s (was %s)", field, reason, value));
        this.field = field;
        this.value = value;
    }

    /**
     * For inputs that are not a single number, such as a missing name or an empty list.
     * {@link #getValue()} is NaN in that case.
     */
    public InvalidInputException(String field, String message) {
        super(field + " " + message);
        this.field = field;
        this.value = Double.NaN;
    }

    public String getField() {
        return field;
    }

    public double getValue() {
        return value;
    }
}
