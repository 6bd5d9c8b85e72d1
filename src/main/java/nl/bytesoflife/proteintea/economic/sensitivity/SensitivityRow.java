package nl.bytesoflife.proteintea.economic.sensitivity;

import java.util.Comparator;

/**
 * Profit impact of perturbing one parameter.
 *
 * @param parameter        the perturbed parameter
 * @param baseValue        the parameter's unperturbed value
 * @param impactPercent    signed relative profit change, %, or null when the base profit is zero
 * @param sensitivityClass class of |impactPercent|, or null when the impact is undefined
 */
public record SensitivityRow(
        SensitivityParameter parameter,
        double baseValue,
        Double impactPercent,
        SensitivityClass sensitivityClass
) {

    /**
     * Display order: largest |impact| first, undefined impacts last.
     */
    public static final Comparator<SensitivityRow> BY_MAGNITUDE = Comparator.comparing(
            (SensitivityRow row) -> row.impactPercent() == null ? -1.0 : Math.abs(row.impactPercent()))
            .reversed();

    public String parameterName() {
        return parameter.key();
    }

    public boolean isDefined() {
        return impactPercent != null;
    }
}
