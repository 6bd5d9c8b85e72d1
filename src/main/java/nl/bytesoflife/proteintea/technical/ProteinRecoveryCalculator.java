package nl.bytesoflife.proteintea.technical;

import nl.bytesoflife.proteintea.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;
import static nl.bytesoflife.proteintea.InputChecks.requirePositive;

/**
 * Derives yield, recovery and annual production volume from the mass flows of a run.
 */
public class ProteinRecoveryCalculator {

    private static final Logger log = LoggerFactory.getLogger(ProteinRecoveryCalculator.class);

    public ProteinRecovery calculate(TechnicalParameters params) {
        validate(params);

        double input = params.inputMassKg();
        double concentrate = params.proteinConcentrateMassKg();
        double cin = params.initialProteinContentPercent();
        double cout = params.outputProteinContentPercent();

        double yield = concentrate / input * 100;
        double recovery = (concentrate * cout) / (input * cin) * 100;
        double loss = input * cin / 100 - concentrate * cout / 100;
        double moistureReduction = params.initialMoisturePercent() - params.finalMoisturePercent();
        double annualVolume = concentrate * params.runsPerYear();

        log.debug("Protein yield {}%, recovery {}%, annual volume {} kg", yield, recovery, annualVolume);
        return new ProteinRecovery(yield, recovery, cout / cin, loss, moistureReduction, annualVolume);
    }

    private static void validate(TechnicalParameters params) {
        if (params == null) {
            throw new IllegalArgumentException("TechnicalParameters must not be null");
        }
        requirePositive("input_mass", params.inputMassKg());
        requirePositive("protein_concentrate_mass", params.proteinConcentrateMassKg());
        if (params.proteinConcentrateMassKg() > params.inputMassKg()) {
            throw new InvalidInputException("protein_concentrate_mass", params.proteinConcentrateMassKg(),
                    "must not exceed the input mass");
        }
        requirePercent("initial_protein_content", params.initialProteinContentPercent());
        requirePercent("output_protein_content", params.outputProteinContentPercent());
        requireNonNegative("initial_moisture_content", params.initialMoisturePercent());
        requireNonNegative("final_moisture_content", params.finalMoisturePercent());
        if (params.initialMoisturePercent() > 100) {
            throw new InvalidInputException("initial_moisture_content", params.initialMoisturePercent(),
                    "must not exceed 100");
        }
        if (params.finalMoisturePercent() > params.initialMoisturePercent()) {
            throw new InvalidInputException("final_moisture_content", params.finalMoisturePercent(),
                    "must not exceed the initial moisture content");
        }
        requirePositive("runs_per_year", params.runsPerYear());
    }

    private static void requirePercent(String field, double value) {
        requirePositive(field, value);
        if (value > 100) {
            throw new InvalidInputException(field, value, "must not exceed 100");
        }
    }
}
