package nl.bytesoflife.proteintea.economic.sensitivity;

/**
 * One point of a sensitivity curve.
 *
 * @param factor         multiplier applied to the base value
 * @param parameterValue the perturbed parameter value
 * @param profit         annual profit at that value, USD/year
 * @param impactPercent  relative profit change against the base, %, or null when the base profit is zero
 */
public record SensitivityPoint(
        double factor,
        double parameterValue,
        double profit,
        Double impactPercent
) {
}
