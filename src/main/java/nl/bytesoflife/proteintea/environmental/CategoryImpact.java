package nl.bytesoflife.proteintea.environmental;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered process contributions of one impact category. The total is always the sum of the contributions.
 */
public class CategoryImpact {

    private final ImpactCategory category;
    private final List<ProcessContribution> contributions;
    private final double total;

    public CategoryImpact(ImpactCategory category, List<ProcessContribution> contributions) {
        this.category = category;
        this.contributions = List.copyOf(contributions);
        double sum = 0;
        for (ProcessContribution contribution : this.contributions) {
            sum += contribution.value();
        }
        this.total = sum;
    }

    public ImpactCategory getCategory() {
        return category;
    }

    public List<ProcessContribution> getContributions() {
        return contributions;
    }

    public double getTotal() {
        return total;
    }

    public Optional<ProcessContribution> getContribution(String process) {
        for (ProcessContribution contribution : contributions) {
            if (contribution.process().equals(process)) {
                return Optional.of(contribution);
            }
        }
        return Optional.empty();
    }

    /**
     * Unit of the total: the category unit, or its per-kg variant once the report has been normalized.
     */
    public Unit getUnit() {
        return contributions.isEmpty() ? category.unit() : contributions.get(0).unit();
    }

    CategoryImpact perKilogram(double massKg) {
        List<ProcessContribution> scaled = new ArrayList<>(contributions.size());
        for (ProcessContribution contribution : contributions) {
            scaled.add(contribution.perKilogram(massKg));
        }
        return new CategoryImpact(category, scaled);
    }
}
