package nl.bytesoflife.proteintea.sustainability;

import nl.bytesoflife.proteintea.environmental.ImpactCategory;
import nl.bytesoflife.proteintea.environmental.ImpactReport;

import java.util.EnumMap;
import java.util.Map;

import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;

/**
 * Relates economic value to environmental impact: value / impact for every category.
 */
public class EcoEfficiencyCalculator {

    public EcoEfficiency calculate(double economicValue, ImpactReport impacts) {
        requireNonNegative("economic_value", economicValue);
        Map<ImpactCategory, Double> ratios = new EnumMap<>(ImpactCategory.class);
        for (ImpactCategory category : ImpactCategory.values()) {
            double impact = impacts.getTotal(category);
            ratios.put(category, impact > 0 ? economicValue / impact : null);
        }
        return new EcoEfficiency(economicValue, ratios);
    }
}
