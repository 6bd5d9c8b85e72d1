package nl.bytesoflife.proteintea.economic.sensitivity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Result of the point sensitivity analysis: one row per parameter, in parameter order.
 */
public class SensitivityReport {

    private final double baseProfit;
    private final double perturbation;
    private final List<SensitivityRow> rows;

    public SensitivityReport(double baseProfit, double perturbation, List<SensitivityRow> rows) {
        this.baseProfit = baseProfit;
        this.perturbation = perturbation;
        this.rows = List.copyOf(rows);
    }

    public double getBaseProfit() {
        return baseProfit;
    }

    public double getPerturbation() {
        return perturbation;
    }

    public List<SensitivityRow> getRows() {
        return rows;
    }

    public SensitivityRow getRow(SensitivityParameter parameter) {
        for (SensitivityRow row : rows) {
            if (row.parameter() == parameter) {
                return row;
            }
        }
        throw new IllegalArgumentException("No sensitivity row for " + parameter.key());
    }

    /**
     * Rows sorted by |impact| descending, for display.
     */
    public List<SensitivityRow> getRowsByMagnitude() {
        List<SensitivityRow> sorted = new ArrayList<>(rows);
        sorted.sort(SensitivityRow.BY_MAGNITUDE);
        return sorted;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Sensitivity Report:\n");
        sb.append(String.format(Locale.US, "  Base profit: %.2f USD/yr, perturbation %+.0f%%",
                baseProfit, perturbation * 100)).append("\n");
        for (SensitivityRow row : getRowsByMagnitude()) {
            if (row.isDefined()) {
                sb.append(String.format(Locale.US, "  - %s: %+.2f%% [%s]",
                        row.parameter().displayName(), row.impactPercent(),
                        row.sensitivityClass().label())).append("\n");
            } else {
                sb.append("  - ").append(row.parameter().displayName()).append(": n/a\n");
            }
        }
        return sb.toString();
    }
}
