package nl.bytesoflife.proteintea.sustainability;

/**
 * An RF metric found outside its benchmark band. Message wording is left to the caller.
 */
public record BandViolation(
        String metricName,
        double currentValue,
        double target,
        double tolerance,
        String unit
) {

    /**
     * Signed distance from the target, in {@link #unit()}.
     */
    public double deviation() {
        return currentValue - target;
    }
}
