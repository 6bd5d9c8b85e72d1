package nl.bytesoflife.proteintea.environmental;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Impacts per category with their process contributions, plus the resource intensities of the run.
 */
public class ImpactReport {

    private final Map<ImpactCategory, CategoryImpact> impacts;
    private final IntensityMetrics intensity;
    private final boolean perKilogram;

    public ImpactReport(Map<ImpactCategory, CategoryImpact> impacts, IntensityMetrics intensity) {
        this(impacts, intensity, false);
    }

    private ImpactReport(Map<ImpactCategory, CategoryImpact> impacts, IntensityMetrics intensity,
                         boolean perKilogram) {
        EnumMap<ImpactCategory, CategoryImpact> copy = new EnumMap<>(ImpactCategory.class);
        for (ImpactCategory category : ImpactCategory.values()) {
            CategoryImpact impact = impacts.get(category);
            if (impact == null) {
                throw new IllegalArgumentException("Missing impact for category " + category.key());
            }
            copy.put(category, impact);
        }
        this.impacts = Collections.unmodifiableMap(copy);
        this.intensity = intensity;
        this.perKilogram = perKilogram;
    }

    public CategoryImpact get(ImpactCategory category) {
        return impacts.get(category);
    }

    public double getTotal(ImpactCategory category) {
        return impacts.get(category).getTotal();
    }

    public Map<ImpactCategory, CategoryImpact> getImpacts() {
        return impacts;
    }

    public IntensityMetrics getIntensity() {
        return intensity;
    }

    public boolean isPerKilogram() {
        return perKilogram;
    }

    /**
     * Category totals keyed by {@link ImpactCategory#key()}, in category order.
     */
    public Map<String, Double> totals() {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (CategoryImpact impact : impacts.values()) {
            totals.put(impact.getCategory().key(), impact.getTotal());
        }
        return totals;
    }

    /**
     * The same report with every contribution divided by the product mass.
     * A report that is already per kg is returned as is.
     */
    public ImpactReport perKgProduct() {
        if (perKilogram) {
            return this;
        }
        double mass = intensity.totalMassKg();
        Map<ImpactCategory, CategoryImpact> scaled = new EnumMap<>(ImpactCategory.class);
        for (CategoryImpact impact : impacts.values()) {
            scaled.put(impact.getCategory(), impact.perKilogram(mass));
        }
        return new ImpactReport(scaled, intensity, true);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Impact Report");
        sb.append(perKilogram ? " (per kg product):\n" : ":\n");
        for (CategoryImpact impact : impacts.values()) {
            sb.append(String.format(Locale.US, "  %s: %.4g %s",
                    impact.getCategory().displayName(), impact.getTotal(), impact.getUnit())).append("\n");
            for (ProcessContribution contribution : impact.getContributions()) {
                sb.append(String.format(Locale.US, "    - %s: %.4g",
                        contribution.process(), contribution.value())).append("\n");
            }
        }
        sb.append(String.format(Locale.US, "  Energy intensity: %.4f kWh/kg", intensity.energyIntensity())).append("\n");
        sb.append(String.format(Locale.US, "  Water intensity: %.4f kg/kg", intensity.waterIntensity())).append("\n");
        return sb.toString();
    }
}
