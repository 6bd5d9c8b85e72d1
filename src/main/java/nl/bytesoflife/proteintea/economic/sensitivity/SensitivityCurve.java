package nl.bytesoflife.proteintea.economic.sensitivity;

import java.util.List;

/**
 * Profit response of one parameter over the configured range.
 */
public class SensitivityCurve {

    private final SensitivityParameter parameter;
    private final double baseValue;
    private final double baseProfit;
    private final List<SensitivityPoint> points;

    public SensitivityCurve(SensitivityParameter parameter, double baseValue, double baseProfit,
                            List<SensitivityPoint> points) {
        this.parameter = parameter;
        this.baseValue = baseValue;
        this.baseProfit = baseProfit;
        this.points = List.copyOf(points);
    }

    public SensitivityParameter getParameter() {
        return parameter;
    }

    public double getBaseValue() {
        return baseValue;
    }

    public double getBaseProfit() {
        return baseProfit;
    }

    public List<SensitivityPoint> getPoints() {
        return points;
    }

    /**
     * Profit difference between the highest and the lowest point of the curve, USD/year.
     */
    public double getProfitSpread() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (SensitivityPoint point : points) {
            min = Math.min(min, point.profit());
            max = Math.max(max, point.profit());
        }
        return points.isEmpty() ? 0 : max - min;
    }
}
