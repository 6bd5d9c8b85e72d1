package nl.bytesoflife.proteintea.economic;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Annualized cost per category, in USD/year. The total is the sum of the categories.
 */
public class AnnualCostBreakdown {

    private final Map<CostCategory, Double> amounts;
    private final double total;

    public AnnualCostBreakdown(Map<CostCategory, Double> amounts) {
        EnumMap<CostCategory, Double> copy = new EnumMap<>(CostCategory.class);
        for (CostCategory category : CostCategory.values()) {
            Double amount = amounts.get(category);
            if (amount == null) {
                throw new IllegalArgumentException("Missing amount for cost category " + category.key());
            }
            copy.put(category, amount);
        }
        this.amounts = Collections.unmodifiableMap(copy);

        double sum = 0;
        for (double amount : copy.values()) {
            sum += amount;
        }
        this.total = sum;
    }

    public double get(CostCategory category) {
        return amounts.get(category);
    }

    public Map<CostCategory, Double> getAmounts() {
        return amounts;
    }

    public double getTotal() {
        return total;
    }

    /**
     * Share of the total taken by the given category, or 0 when the total is 0.
     */
    public double getShare(CostCategory category) {
        return total > 0 ? get(category) / total : 0;
    }
}
