package nl.bytesoflife.proteintea.sustainability;

import static nl.bytesoflife.proteintea.InputChecks.requireFinite;
import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;

/**
 * Operating point of the radio-frequency pretreatment.
 *
 * @param temperatureOutfeedC       product temperature at the outfeed, °C
 * @param temperatureElectrodeC     electrode temperature, °C
 * @param energyContributionPercent RF share of the process energy, %
 * @param anodeCurrentA             anode current, A, or null when not measured
 * @param gridCurrentA              grid current, A, or null when not measured
 */
public record RfProcessParameters(
        double temperatureOutfeedC,
        double temperatureElectrodeC,
        double energyContributionPercent,
        Double anodeCurrentA,
        Double gridCurrentA
) {

    public RfProcessParameters {
        requireFinite("temperature_outfeed", temperatureOutfeedC);
        requireFinite("temperature_electrode", temperatureElectrodeC);
        requireNonNegative("energy_contribution", energyContributionPercent);
        if (anodeCurrentA != null) requireNonNegative("anode_current", anodeCurrentA);
        if (gridCurrentA != null) requireNonNegative("grid_current", gridCurrentA);
    }

    public static RfProcessParameters of(double temperatureOutfeedC, double temperatureElectrodeC,
                                         double energyContributionPercent) {
        return new RfProcessParameters(temperatureOutfeedC, temperatureElectrodeC, energyContributionPercent,
                null, null);
    }
}
