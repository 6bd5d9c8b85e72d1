package nl.bytesoflife.proteintea.sustainability;

import nl.bytesoflife.proteintea.environmental.ImpactCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Economic value created per unit of impact, per category. A ratio is null when the category has no impact.
 */
public class EcoEfficiency {

    private final double economicValue;
    private final Map<ImpactCategory, Double> ratios;

    public EcoEfficiency(double economicValue, Map<ImpactCategory, Double> ratios) {
        this.economicValue = economicValue;
        EnumMap<ImpactCategory, Double> copy = new EnumMap<>(ImpactCategory.class);
        copy.putAll(ratios);
        this.ratios = Collections.unmodifiableMap(copy);
    }

    public double getEconomicValue() {
        return economicValue;
    }

    /**
     * USD per unit of the category's impact, or null when the impact is not positive.
     */
    public Double get(ImpactCategory category) {
        return ratios.get(category);
    }

    public Map<ImpactCategory, Double> getRatios() {
        return ratios;
    }
}
