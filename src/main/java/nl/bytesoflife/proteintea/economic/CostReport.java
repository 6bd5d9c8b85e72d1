package nl.bytesoflife.proteintea.economic;

import java.util.Locale;
import java.util.Map;

/**
 * Result of the cost model: annual breakdown, total annual cost and unit cost.
 */
public class CostReport {

    private final AnnualCostBreakdown breakdown;
    private final double productionVolumeKgPerYear;
    private final double totalInvestment;

    public CostReport(AnnualCostBreakdown breakdown, double productionVolumeKgPerYear, double totalInvestment) {
        this.breakdown = breakdown;
        this.productionVolumeKgPerYear = productionVolumeKgPerYear;
        this.totalInvestment = totalInvestment;
    }

    public AnnualCostBreakdown getBreakdown() {
        return breakdown;
    }

    public double getTotalAnnualCost() {
        return breakdown.getTotal();
    }

    /**
     * Total annual cost per kg produced, USD/kg.
     */
    public double getUnitCost() {
        return breakdown.getTotal() / productionVolumeKgPerYear;
    }

    public double getProductionVolumeKgPerYear() {
        return productionVolumeKgPerYear;
    }

    public double getTotalInvestment() {
        return totalInvestment;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Cost Report:\n");
        for (Map.Entry<CostCategory, Double> entry : breakdown.getAmounts().entrySet()) {
            sb.append(String.format(Locale.US, "  - %s: %.2f USD/yr (%.1f%%)",
                    entry.getKey().key(), entry.getValue(),
                    breakdown.getShare(entry.getKey()) * 100)).append("\n");
        }
        sb.append(String.format(Locale.US, "  Total annual cost: %.2f USD/yr", getTotalAnnualCost())).append("\n");
        sb.append(String.format(Locale.US, "  Unit cost: %.4f USD/kg", getUnitCost())).append("\n");
        sb.append(String.format(Locale.US, "  Total investment: %.2f USD", totalInvestment)).append("\n");
        return sb.toString();
    }
}
