package nl.bytesoflife.proteintea.environmental;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static nl.bytesoflife.proteintea.InputChecks.requireFraction;
import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;
import static nl.bytesoflife.proteintea.InputChecks.requirePositive;

/**
 * Converts the resource consumption of a process run into impacts per category.
 * Each contribution is a factor times its driver; the category total is always
 * recomputed from the contributions of the current call.
 *
 * <pre>
 * ImpactReport report = new ImpactModel()
 *     .withFactors(BuiltinImpactFactors.dryFractionation())
 *     .calculate(inputs);
 * </pre>
 */
public class ImpactModel {

    private static final Logger log = LoggerFactory.getLogger(ImpactModel.class);

    private ImpactFactorTable factors = BuiltinImpactFactors.dryFractionation();

    public ImpactModel withFactors(ImpactFactorTable factors) {
        if (factors == null) {
            throw new IllegalArgumentException("ImpactFactorTable must not be null");
        }
        this.factors = factors;
        return this;
    }

    public ImpactFactorTable getFactors() {
        return factors;
    }

    public ImpactReport calculate(ImpactInputs inputs) {
        validate(inputs);

        Map<ImpactCategory, CategoryImpact> impacts = new EnumMap<>(ImpactCategory.class);
        for (ImpactCategory category : ImpactCategory.values()) {
            List<ProcessContribution> contributions = new ArrayList<>();
            for (ImpactFactor factor : factors.getFactors(category)) {
                Double driver = factor.driver().resolve(inputs);
                // step not present in this process variant
                if (driver == null) {
                    continue;
                }
                contributions.add(new ProcessContribution(factor.process(), factor.factor() * driver, category.unit()));
            }
            impacts.put(category, new CategoryImpact(category, contributions));
        }

        IntensityMetrics intensity = IntensityMetrics.of(inputs.consumption(), inputs.productMassKg());
        ImpactReport report = new ImpactReport(impacts, intensity);
        log.debug("Impact totals ({}): {}", factors.getName(), report.totals());
        return report;
    }

    private static void validate(ImpactInputs inputs) {
        if (inputs == null || inputs.consumption() == null) {
            throw new IllegalArgumentException("ImpactInputs with consumption metrics must be provided");
        }
        ConsumptionMetrics consumption = inputs.consumption();
        requireNonNegative("electricity_kwh", consumption.electricityKwh());
        requireNonNegative("water_kg", consumption.waterKg());
        if (consumption.coolingKwh() != null) {
            requireNonNegative("cooling_kwh", consumption.coolingKwh());
        }
        if (consumption.thermalKwh() != null) {
            requireNonNegative("thermal_kwh", consumption.thermalKwh());
        }
        requireNonNegative("transport_ton_km", inputs.transportTonKm());
        requireNonNegative("waste_kg", inputs.wasteKg());
        requirePositive("product_mass_kg", inputs.productMassKg());
        requireNonNegative("equipment_mass_kg", inputs.equipmentMassKg());
        requireFraction("thermal_processing_share", inputs.thermalProcessingShare());
    }
}
